package com.fleet.anomaly.repository;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fleet.anomaly.exception.AnomalyStoreException;
import com.fleet.anomaly.exception.FeatureSchemaException;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.FeatureTable;
import com.fleet.anomaly.model.RecordKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Reads the aggregated feature table produced by the upstream aggregation step.
 *
 * Format: CSV with a header row, gzip-compressed when the file name ends in ".gz".
 * The table is validated while it is read; any schema problem aborts the load.
 */
@Repository
public class FeatureTableRepository {

    private static final Logger log = LoggerFactory.getLogger(FeatureTableRepository.class);

    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "null", "na", "none");

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private static final Pattern OFFSET_SUFFIX = Pattern.compile("[+-]\\d{2}:\\d{2}$");

    private final CsvMapper csvMapper;

    public FeatureTableRepository() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        // Surrounding whitespace is dropped; the trimmed cell is what the output table carries
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    /**
     * Load and validate the feature table.
     *
     * @param path            CSV or CSV.GZ file
     * @param unitColumn      column holding the unit id
     * @param timeColumn      column holding the time bucket
     * @param requiredNumeric numeric columns that must be present and parseable
     * @throws FeatureSchemaException on a missing column, bad or duplicate key, or bad required value
     * @throws AnomalyStoreException  when the file cannot be read
     */
    public FeatureTable load(Path path, String unitColumn, String timeColumn, Collection<String> requiredNumeric) {
        log.info("Loading feature table from {}", path);

        try (InputStream in = open(path);
             MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(in)) {

            if (!rows.hasNext()) {
                throw new FeatureSchemaException("Feature table " + path + " is empty (no header row)");
            }
            List<String> header = Arrays.asList(rows.next());
            validateHeader(header, unitColumn, timeColumn, requiredNumeric);

            int unitIdx = header.indexOf(unitColumn);
            int timeIdx = header.indexOf(timeColumn);
            Set<String> required = new HashSet<>(requiredNumeric);
            Set<RecordKey> seenKeys = new HashSet<>();
            List<FeatureRecord> records = new ArrayList<>();

            long line = 1;
            while (rows.hasNext()) {
                line++;
                String[] cells = rows.next();
                if (cells.length != header.size()) {
                    throw new FeatureSchemaException(String.format(
                            "Row %d has %d cells, header has %d columns", line, cells.length, header.size()));
                }
                FeatureRecord record = toRecord(header, cells, unitIdx, timeIdx, required, line);
                if (!seenKeys.add(record.getKey())) {
                    throw new FeatureSchemaException("Duplicate key " + record.getKey() + " at row " + line);
                }
                records.add(record);
            }

            FeatureTable table = new FeatureTable(header, records);
            log.info("Loaded {} rows, {} columns, {} units",
                    table.size(), header.size(), table.groupByUnit().size());
            return table;
        } catch (RuntimeJsonMappingException e) {
            throw new FeatureSchemaException("Malformed CSV in feature table " + path + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new AnomalyStoreException("Feature table not found: " + path, e);
        } catch (IOException e) {
            throw new AnomalyStoreException("Failed to read feature table " + path, e);
        }
    }

    private void validateHeader(List<String> header, String unitColumn, String timeColumn,
                                Collection<String> requiredNumeric) {
        Set<String> present = new HashSet<>();
        for (String column : header) {
            if (!present.add(column)) {
                throw new FeatureSchemaException("Duplicate column in header: " + column);
            }
        }

        Set<String> missing = new LinkedHashSet<>();
        for (String column : List.of(unitColumn, timeColumn)) {
            if (!present.contains(column)) missing.add(column);
        }
        for (String column : requiredNumeric) {
            if (!present.contains(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new FeatureSchemaException("Feature table is missing required columns: " + missing);
        }
    }

    private FeatureRecord toRecord(List<String> header, String[] cells, int unitIdx, int timeIdx,
                                   Set<String> required, long line) {
        String unitId = cells[unitIdx];
        if (unitId == null || unitId.isBlank()) {
            throw new FeatureSchemaException("Missing unit id at row " + line);
        }
        Instant timeBucket = parseTimeBucket(cells[timeIdx], line);

        Map<String, String> columns = new LinkedHashMap<>();
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < cells.length; i++) {
            String column = header.get(i);
            String cell = cells[i];
            columns.put(column, cell);
            if (i == unitIdx || i == timeIdx) {
                continue;
            }
            Double value = parseNumber(cell);
            if (value != null) {
                values.put(column, value);
            } else if (required.contains(column)) {
                throw new FeatureSchemaException(String.format(
                        "Column %s at row %d is not numeric: '%s'", column, line, cell));
            }
        }

        return FeatureRecord.builder()
                .unitId(unitId)
                .timeBucket(timeBucket)
                .columns(columns)
                .values(values)
                .build();
    }

    /**
     * @return the value, NaN for a missing cell, or null when the cell is not a number
     */
    static Double parseNumber(String cell) {
        if (cell == null || MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT))) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts ISO-8601 instants or offset date-times, and local date-times with 'T' or a space
     * separator; local values are taken as UTC.
     */
    static Instant parseTimeBucket(String cell, long line) {
        if (cell == null || cell.isBlank()) {
            throw new FeatureSchemaException("Missing time bucket at row " + line);
        }
        String text = cell.trim();
        try {
            if (text.endsWith("Z") || OFFSET_SUFFIX.matcher(text).find()) {
                return OffsetDateTime.parse(text).toInstant();
            }
            DateTimeFormatter format = text.indexOf('T') >= 0
                    ? DateTimeFormatter.ISO_LOCAL_DATE_TIME
                    : SPACE_SEPARATED;
            return LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new FeatureSchemaException("Unparseable time bucket '" + cell + "' at row " + line, e);
        }
    }

    private InputStream open(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        if (path.getFileName().toString().endsWith(".gz")) {
            return new GZIPInputStream(in);
        }
        return in;
    }
}
