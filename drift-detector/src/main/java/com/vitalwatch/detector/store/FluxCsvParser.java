package com.vitalwatch.detector.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the CSV body of an InfluxDB {@code /api/v2/query} response.
 *
 * <p>A response is one or more tables. Each table starts with a header row (it always contains
 * the {@code result} and {@code table} columns) optionally preceded by {@code #}-annotation rows.
 * Every following row is mapped against the most recent header.
 *
 * <p>Errors raised while the query runs arrive with status 200 as a table whose first named
 * column is {@code error} (followed by {@code reference}). Such a table is reported as an
 * {@link IllegalArgumentException}, never returned as rows.
 */
public final class FluxCsvParser {

    private static final Logger log = LoggerFactory.getLogger(FluxCsvParser.class);

    public static final String VALUE_COLUMN = "_value";
    public static final String ERROR_COLUMN = "error";

    private static final CsvMapper CSV = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    private FluxCsvParser() {}

    /**
     * @param body raw CSV text; blank means "no rows"
     * @return one column-name → cell map per data row, in response order
     * @throws IllegalArgumentException when the body is not readable as CSV, or is an error table
     */
    public static List<Map<String, String>> parse(String body) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return rows;
        }

        String[] headers = null;
        try (MappingIterator<String[]> records = CSV.readerFor(String[].class).readValues(body)) {
            while (records.hasNext()) {
                String[] record = records.next();
                if (record.length == 0 || isBlank(record)) {
                    continue;
                }
                if (record[0].startsWith("#")) {
                    headers = null;
                    continue;
                }
                if (headers == null || isHeader(record) || isErrorTable(record)) {
                    headers = record;
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>(headers.length);
                for (int i = 0; i < headers.length && i < record.length; i++) {
                    row.put(headers[i], record[i]);
                }
                if (isErrorTable(headers)) {
                    throw new IllegalArgumentException("Flux query error: " + row.get(ERROR_COLUMN));
                }
                rows.add(row);
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new IllegalArgumentException("Unreadable Flux CSV response", e);
        }
        if (headers != null && isErrorTable(headers)) {
            throw new IllegalArgumentException("Flux query error without message");
        }
        return rows;
    }

    /**
     * Extracts the numeric {@code _value} of every row. Missing, non-numeric and non-finite cells
     * are dropped: a malformed sample counts as an absent sample.
     */
    public static List<Double> values(List<Map<String, String>> rows) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            String cell = row.get(VALUE_COLUMN);
            if (cell == null || cell.isBlank()) {
                log.debug("Discarding row without {} cell: {}", VALUE_COLUMN, row);
                continue;
            }
            try {
                double value = Double.parseDouble(cell.trim());
                if (Double.isFinite(value)) {
                    values.add(value);
                } else {
                    log.debug("Discarding non-finite sample: {}", cell);
                }
            } catch (NumberFormatException e) {
                log.debug("Discarding non-numeric sample: {}", cell);
            }
        }
        return values;
    }

    /** First non-empty header cell is {@code error}. */
    private static boolean isErrorTable(String[] headers) {
        for (String cell : headers) {
            if (cell != null && !cell.isBlank()) {
                return ERROR_COLUMN.equals(cell.trim());
            }
        }
        return false;
    }

    private static boolean isHeader(String[] record) {
        boolean result = false;
        boolean table  = false;
        for (String cell : record) {
            if ("result".equals(cell)) result = true;
            if ("table".equals(cell))  table  = true;
        }
        return result && table;
    }

    private static boolean isBlank(String[] record) {
        for (String cell : record) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
