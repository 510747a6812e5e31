package com.osman.badges.cli;

import com.osman.badges.config.GeneratorSettings;
import com.osman.badges.config.SettingsLoader;
import com.osman.badges.core.BadgeException;
import com.osman.badges.core.InvalidConfigException;
import com.osman.badges.core.pdf.FontRegistry;
import com.osman.badges.core.pipeline.BadgePipeline;
import com.osman.badges.core.pipeline.BatchSummary;
import com.osman.badges.core.rows.CsvRowReader;
import com.osman.badges.core.rows.RecordMapper;
import com.osman.badges.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: reads a CSV file and writes one QR image and one badge PDF per row.
 * <pre>
 *   java -jar badge-generator.jar [list.csv] [--config=badges.properties] [--qr-only]
 * </pre>
 * Without a CSV argument the {@code input.file} setting is used. Exit status is 0 when every row
 * succeeded, 2 when some rows failed and 1 when the run could not start.
 */
public final class BadgeGeneratorTool {

    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_PARTIAL = 2;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private BadgeGeneratorTool() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.severe(ex.getMessage());
            return EXIT_FATAL;
        }

        try {
            GeneratorSettings settings = SettingsLoader.load(arguments.configFile());
            if (arguments.inputFile() != null) {
                settings = settings.withInputFile(arguments.inputFile());
            }
            Path input = settings.input()
                .orElseThrow(() -> new InvalidConfigException("No input file: pass a CSV path or set badges.input.file"));
            if (!Files.isRegularFile(input)) {
                throw new IOException("Input file not found: " + input);
            }

            FontRegistry fonts = registerFonts(settings);
            List<List<String>> rows = new CsvRowReader(settings.skipRows()).read(input);

            var options = settings.toPipelineOptions();
            if (arguments.qrOnly()) {
                options = options.withQrOnly(true);
            }
            BadgePipeline pipeline = new BadgePipeline(
                options,
                new RecordMapper(settings.nameColumn(), settings.identifierColumn()),
                fonts);

            BatchSummary summary = runWithShutdownHook(pipeline, rows);
            return summary.hasFailures() ? EXIT_PARTIAL : EXIT_OK;
        } catch (InvalidConfigException ex) {
            LOGGER.severe("Invalid configuration: " + ex.getMessage());
            return EXIT_FATAL;
        } catch (BadgeException | IOException ex) {
            LOGGER.log(Level.SEVERE, "Badge generation aborted: " + ex.getMessage(), ex);
            return EXIT_FATAL;
        }
    }

    static FontRegistry registerFonts(GeneratorSettings settings) throws IOException {
        FontRegistry fonts = FontRegistry.withStandardFonts();
        for (Path directory : settings.fontDirectories()) {
            int count = fonts.loadFontsFromDirectory(directory);
            LOGGER.info("Registered %d font(s) from %s".formatted(count, directory));
        }
        for (Map.Entry<String, Path> entry : settings.fontFiles().entrySet()) {
            fonts.registerFontFile(entry.getKey(), entry.getValue());
            LOGGER.info("Registered font %s from %s".formatted(entry.getKey(), entry.getValue()));
        }
        return fonts;
    }

    private static BatchSummary runWithShutdownHook(BadgePipeline pipeline, List<List<String>> rows)
        throws BadgeException {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            LOGGER.warning("Interrupted: finishing records in progress, skipping the rest.");
            pipeline.requestStop();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "badge-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return pipeline.run(rows);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException alreadyShuttingDown) {
                LOGGER.fine("JVM is shutting down; the hook returns now that the run has finished.");
            }
        }
    }

    record Arguments(Path inputFile, Path configFile, boolean qrOnly) {

        static Arguments parse(String[] args) {
            Path input = null;
            Path config = null;
            boolean qrOnly = false;
            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) continue;
                    String trimmed = arg.trim();
                    if (trimmed.equals("--qr-only")) {
                        qrOnly = true;
                    } else if (trimmed.startsWith("--config=")) {
                        config = Path.of(trimmed.substring("--config=".length()));
                    } else if (trimmed.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + trimmed);
                    } else if (input == null) {
                        input = Path.of(trimmed);
                    } else {
                        throw new IllegalArgumentException("Only one input file is supported, got " + trimmed);
                    }
                }
            }
            return new Arguments(input, config, qrOnly);
        }
    }
}
