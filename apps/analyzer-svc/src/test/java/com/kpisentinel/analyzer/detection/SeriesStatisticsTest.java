package com.kpisentinel.analyzer.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SeriesStatisticsTest {

    @Test
    void percentileInterpolatesLinearlyBetweenRanks() {
        double[] values = {1, 2, 3, 4, 5};

        assertThat(SeriesStatistics.percentile(values, 25)).isEqualTo(2.0);
        assertThat(SeriesStatistics.percentile(values, 75)).isEqualTo(4.0);
        assertThat(SeriesStatistics.percentile(new double[]{1, 2, 3, 4}, 25)).isCloseTo(1.75, within(1e-12));
        assertThat(SeriesStatistics.median(new double[]{4, 1, 3, 2})).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void standardDeviationIsPopulationBased() {
        assertThat(SeriesStatistics.populationStd(new double[]{2, 4, 4, 4, 5, 5, 7, 9})).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void emptyInputYieldsNaN() {
        assertThat(SeriesStatistics.mean(new double[0])).isNaN();
        assertThat(SeriesStatistics.populationStd(new double[0])).isNaN();
        assertThat(SeriesStatistics.percentile(new double[0], 50)).isNaN();
    }

    @Test
    void percentChangeIsZeroAgainstZeroBaseline() {
        assertThat(SeriesStatistics.percentChange(150, 100)).isCloseTo(50.0, within(1e-12));
        assertThat(SeriesStatistics.percentChange(5, 0)).isZero();
    }
}
