package com.kpisentinel.analyzer.ingest;

import com.kpisentinel.analyzer.config.AnalyzerProperties;
import com.kpisentinel.analyzer.detection.SeriesStatistics;
import com.kpisentinel.analyzer.model.KpiDataset;
import com.kpisentinel.analyzer.observability.ExecutionTracer;
import com.kpisentinel.analyzer.session.KpiSession;
import com.kpisentinel.analyzer.session.KpiSessionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class KpiIngestionService {

    private static final Logger log = LoggerFactory.getLogger(KpiIngestionService.class);
    private static final Set<String> MISSING_MARKERS =
            Set.of("", "NaN", "nan", "-NaN", "-nan", "NA", "N/A", "n/a", "<NA>", "null", "NULL", "None", "#N/A", "#NA");

    private final KpiCsvReader csvReader;
    private final KpiSessionRepository sessionRepository;
    private final ExecutionTracer tracer;
    private final AnalyzerProperties properties;

    public KpiIngestionService(
            KpiCsvReader csvReader,
            KpiSessionRepository sessionRepository,
            ExecutionTracer tracer,
            AnalyzerProperties properties
    ) {
        this.csvReader = csvReader;
        this.sessionRepository = sessionRepository;
        this.tracer = tracer;
        this.properties = properties;
    }

    public IngestionResult ingest(String sessionId, String csvContent) {
        return tracer.trace("ingest_kpi_data", Map.of("session_id", sessionId), () -> doIngest(sessionId, csvContent));
    }

    private IngestionResult doIngest(String sessionId, String csvContent) {
        KpiDataset raw = csvReader.read(csvContent);
        KpiDataset cleaned = clean(raw);
        if (cleaned.rowCount() == 0) {
            throw new IllegalArgumentException("CSV contains no data rows");
        }
        int maxDataPoints = properties.ingest().maxDataPoints();
        if (cleaned.rowCount() > maxDataPoints) {
            throw new IllegalArgumentException("CSV has " + cleaned.rowCount()
                    + " rows, more than the configured limit of " + maxDataPoints);
        }
        Instant now = Instant.now();
        sessionRepository.save(KpiSession.ingested(sessionId, raw, cleaned, now));
        log.info("Ingested session={} rows={} columns={} numericColumns={}",
                sessionId, cleaned.rowCount(), cleaned.columns().size(), cleaned.numericColumnNames());
        return new IngestionResult(
                sessionId,
                cleaned.rowCount(),
                cleaned.columns(),
                cleaned.numericColumnNames(),
                cleaned.hasDateColumn(),
                now
        );
    }

    /**
     * Drops fully blank rows, recognises date columns by name, classifies a column as numeric when
     * every non-missing cell is a plain decimal number, and fills gaps in numeric columns with the
     * column median. Missing cells are blanks and markers such as {@code NA}, {@code NaN} or
     * {@code null}.
     */
    KpiDataset clean(KpiDataset raw) {
        List<List<String>> rows = raw.rows().stream()
                .filter(row -> row.stream().anyMatch(cell -> cell != null && !cell.isBlank()))
                .toList();
        List<String> dateColumns = new ArrayList<>();
        Map<String, double[]> numericColumns = new LinkedHashMap<>();
        List<String> columns = raw.columns();
        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            if (column.toLowerCase(Locale.ROOT).contains("date")) {
                dateColumns.add(column);
                continue;
            }
            double[] values = parseNumeric(rows, c);
            if (values != null) {
                numericColumns.put(column, values);
            }
        }
        return new KpiDataset(columns, rows, dateColumns, numericColumns);
    }

    private static double[] parseNumeric(List<List<String>> rows, int columnIndex) {
        double[] values = new double[rows.size()];
        List<Double> present = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            String cell = rows.get(r).get(columnIndex);
            if (isMissing(cell)) {
                values[r] = Double.NaN;
                continue;
            }
            double value;
            try {
                value = new BigDecimal(cell.trim()).doubleValue();
            } catch (NumberFormatException ex) {
                return null;
            }
            if (!Double.isFinite(value)) {
                return null;
            }
            values[r] = value;
            present.add(value);
        }
        if (present.isEmpty()) {
            return null;
        }
        if (present.size() < values.length) {
            double median = SeriesStatistics.median(present.stream().mapToDouble(Double::doubleValue).toArray());
            for (int r = 0; r < values.length; r++) {
                if (Double.isNaN(values[r])) {
                    values[r] = median;
                }
            }
        }
        return values;
    }

    static boolean isMissing(String cell) {
        return cell == null || MISSING_MARKERS.contains(cell.trim());
    }
}
