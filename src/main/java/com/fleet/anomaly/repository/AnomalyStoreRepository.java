package com.fleet.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fleet.anomaly.exception.AnomalyStoreException;
import com.fleet.anomaly.model.AnomalyRecord;
import com.fleet.anomaly.model.DetectionSummary;
import com.fleet.anomaly.model.FeatureColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Persists the augmented anomaly table.
 *
 * The table is written to a temporary file next to the target and moved into place only when
 * complete, so a failed run never leaves a partial artifact. Each run replaces the previous
 * artifact wholesale.
 */
@Repository
public class AnomalyStoreRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyStoreRepository.class);

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public AnomalyStoreRepository(ObjectMapper objectMapper) {
        this.csvMapper = new CsvMapper();
        // Quote only cells that need it; input cells are written back as the reader trimmed them
        this.csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        this.objectMapper = objectMapper;
    }

    /**
     * Write the anomaly table: the input columns in input order followed by the detection columns.
     * Input columns named like a detection column (an earlier run's output fed back in) are
     * dropped; the detection columns are always recomputed.
     *
     * @throws AnomalyStoreException when the artifact cannot be written
     */
    public void save(Path target, List<String> inputColumns, List<AnomalyRecord> records, String tagDelimiter) {
        List<String> keptColumns = inputColumns.stream()
                .filter(column -> !FeatureColumns.OUTPUT_COLUMNS.contains(column))
                .toList();
        if (keptColumns.size() < inputColumns.size()) {
            log.warn("Input already carries detection columns; replacing them in {}", target);
        }
        List<String> header = new ArrayList<>(keptColumns);
        header.addAll(FeatureColumns.OUTPUT_COLUMNS);

        // Header is written as a plain row so an empty table still carries its columns
        writeAtomically(target, out -> {
            try (SequenceWriter writer = csvMapper.writerFor(String[].class)
                    .with(CsvSchema.emptySchema())
                    .writeValues(out)) {
                writer.write(header.toArray(new String[0]));
                for (AnomalyRecord record : records) {
                    writer.write(toRow(record, keptColumns, tagDelimiter));
                }
            }
        });

        log.info("Saved {} rows to {}", records.size(), target);
    }

    /**
     * Write the run summary as JSON next to the table.
     */
    public void saveSummary(Path target, DetectionSummary summary) {
        writeAtomically(target, out -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, summary));
        log.info("Saved run summary to {}", target);
    }

    private String[] toRow(AnomalyRecord record, List<String> inputColumns, String tagDelimiter) {
        List<String> row = new ArrayList<>(inputColumns.size() + FeatureColumns.OUTPUT_COLUMNS.size());
        for (String column : inputColumns) {
            String cell = record.getFeature().getColumns().get(column);
            row.add(cell == null ? "" : cell);
        }
        row.add(formatDecimal(record.getSpeedChange()));
        row.add(String.valueOf(record.getFlagRule()));
        row.add(String.valueOf(record.getFlagMad()));
        row.add(String.valueOf(record.getFlagMl()));
        row.add(record.tagString(tagDelimiter));
        row.add(String.valueOf(record.getScore()));
        row.add(record.isAnomaly() ? "1" : "0");
        return row.toArray(new String[0]);
    }

    static String formatDecimal(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private void writeAtomically(Path target, StreamWriter content) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");

            boolean gzip = target.getFileName().toString().endsWith(".gz");
            try (OutputStream raw = new BufferedOutputStream(Files.newOutputStream(tmp));
                 OutputStream out = gzip ? new GZIPOutputStream(raw) : raw) {
                content.write(out);
            }

            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new AnomalyStoreException("Failed to write " + target, e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }
}
