package com.kpisentinel.analyzer.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.kpisentinel.analyzer.model.KpiDataset;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reads a CSV upload with a header row into an unclassified {@link KpiDataset}. Header names are
 * trimmed; rows shorter than the header are padded with blank cells.
 */
@Component
public class KpiCsvReader {

    private final ObjectReader reader;

    public KpiCsvReader() {
        this.reader = new CsvMapper()
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public KpiDataset read(String csvContent) {
        if (csvContent == null || csvContent.isBlank()) {
            throw new IllegalArgumentException("CSV content is empty");
        }
        List<String[]> records;
        try (MappingIterator<String[]> iterator = reader.readValues(csvContent)) {
            records = iterator.readAll();
        } catch (IOException | RuntimeJsonMappingException ex) {
            throw new IllegalArgumentException("Malformed CSV: " + ex.getMessage(), ex);
        }
        if (records.isEmpty()) {
            throw new IllegalArgumentException("CSV content is empty");
        }

        List<String> header = header(records.get(0));
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            String[] cells = records.get(r);
            if (cells.length > header.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + cells.length
                        + " cells but the header declares " + header.size() + " columns");
            }
            List<String> row = new ArrayList<>(Arrays.asList(cells));
            while (row.size() < header.size()) {
                row.add("");
            }
            rows.add(row);
        }
        return new KpiDataset(header, rows, List.of(), null);
    }

    private static List<String> header(String[] cells) {
        List<String> header = new ArrayList<>(cells.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < cells.length; i++) {
            String name = cells[i] == null ? "" : cells[i].trim();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate column '" + name + "' in CSV header");
            }
            header.add(name);
        }
        return header;
    }
}
