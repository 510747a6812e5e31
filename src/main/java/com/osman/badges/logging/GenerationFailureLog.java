package com.osman.badges.logging;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Appends per-record generation failures to a CSV report so the offending input rows
 * can be located after a batch without digging through console output.
 */
public final class GenerationFailureLog {

    public static final String DEFAULT_FILE_NAME = "generation-failures.csv";

    private static final Logger LOGGER = AppLogger.get();
    private static final String HEADER = "timestamp,row_index,raw_name,stage,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private final Path logFile;

    public GenerationFailureLog(Path logFile) {
        this.logFile = Objects.requireNonNull(logFile, "logFile");
    }

    public Path logFile() {
        return logFile;
    }

    public void logFailure(int rowIndex, String rawName, String stage, Exception exception) {
        String message = exception == null ? "" : exception.getMessage();
        String exceptionType = exception == null ? "" : exception.getClass().getName();

        String[] columns = new String[] {
            TIMESTAMP_FORMAT.format(Instant.now()),
            Integer.toString(rowIndex),
            rawName != null ? rawName : "",
            stage != null ? stage : "",
            exceptionType,
            message != null ? message : ""
        };
        writeRow(columns);
    }

    private synchronized void writeRow(String[] columns) {
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            boolean fileExists = Files.exists(logFile);
            try (BufferedWriter writer = Files.newBufferedWriter(
                logFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                if (!fileExists) {
                    writer.write(HEADER);
                    writer.newLine();
                }
                writer.write(toCsv(columns));
                writer.newLine();
            }
        } catch (IOException ioEx) {
            LOGGER.warning("Failed to write failure report " + logFile + ": " + ioEx.getMessage());
        }
    }

    /**
     * Joins the columns into one CSV line. Line breaks become spaces, unpaired surrogates
     * become {@code '?'}, and values containing commas or quotes are quoted.
     */
    static String toCsv(String[] columns) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(escape(columns[i]));
        }
        return builder.toString();
    }

    private static String escape(String value) {
        String safe = value == null ? "" : new String(value.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        safe = safe.replace("\r", " ").replace("\n", " ");
        if (safe.indexOf(',') >= 0 || safe.indexOf('"') >= 0) {
            return "\"" + safe.replace("\"", "\"\"") + "\"";
        }
        return safe;
    }
}
