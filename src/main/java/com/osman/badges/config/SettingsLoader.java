package com.osman.badges.config;

import com.osman.badges.core.InvalidConfigException;
import com.osman.badges.core.pdf.PageConfig;
import com.osman.badges.core.pdf.RgbColor;
import com.osman.badges.core.qr.ErrorCorrection;
import com.osman.badges.core.qr.QrConfig;
import com.osman.badges.logging.AppLogger;
import com.osman.badges.logging.GenerationFailureLog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Resolves {@link GeneratorSettings}. Each key is taken from the first non-blank of: the system
 * property {@code badges.<key>}, the environment variable {@code BADGES_<KEY>} (dots and dashes
 * become underscores), the properties file, and finally the built-in default.
 * <p>
 * The properties file is the one passed to {@link #load(Path)}, else the file named by the
 * {@code badges.config} system property, else {@value #CLASSPATH_FILE} on the classpath.
 */
public final class SettingsLoader {
    private static final Logger LOGGER = AppLogger.get();

    static final String CLASSPATH_FILE = "badge-generator.properties";
    private static final String CONFIG_FILE_PROPERTY = "badges.config";
    private static final String SYSTEM_PREFIX = "badges.";
    private static final String ENV_PREFIX = "BADGES_";

    private final Properties fileProps;
    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environment;

    SettingsLoader(Properties fileProps, UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        this.fileProps = fileProps;
        this.systemProperties = systemProperties;
        this.environment = environment;
    }

    /**
     * Loads settings using the given properties file, or the default lookup when {@code null}.
     *
     * @throws IOException            if an explicitly named properties file cannot be read
     * @throws InvalidConfigException if a value is malformed or out of range
     */
    public static GeneratorSettings load(Path propertiesFile) throws IOException {
        Properties props = loadFileProperties(propertiesFile);
        return new SettingsLoader(props, System::getProperty, System::getenv).resolve();
    }

    GeneratorSettings resolve() {
        QrConfig qrConfig = new QrConfig(
            intValue("qr.version", 3),
            errorCorrection(string("qr.error-correction", "L")),
            intValue("qr.box-size", 10),
            intValue("qr.border", 4),
            ColorNames.parse(string("qr.fill-color", "black")),
            ColorNames.parse(string("qr.back-color", "white")));

        String background = string("page.background", null);
        PageConfig pageConfig = new PageConfig(
            floatValue("page.width", 300f),
            floatValue("page.height", 400f),
            background == null ? null : Paths.get(background),
            string("page.title.font", "Helvetica"),
            floatValue("page.title.font-size", 16f),
            RgbColor.parse(string("page.title.color", "0,0,0")),
            string("page.number.font", "Helvetica"),
            floatValue("page.number.font-size", 12f),
            RgbColor.parse(string("page.number.color", "0,0,0")),
            floatValue("page.qr-size", 150f),
            floatValue("page.title.y-offset", 0f),
            floatValue("page.qr.y-offset", 10f),
            floatValue("page.number.y-offset", 30f));

        String input = string("input.file", null);
        Path pdfDirectory = Paths.get(string("output.pdf-dir", "PDF_files"));
        String failureReport = string("output.failure-report", GenerationFailureLog.DEFAULT_FILE_NAME);

        return new GeneratorSettings(
            input == null ? null : Paths.get(input),
            intValue("input.skip-rows", 1),
            intValue("input.name-column", 0),
            intValue("input.identifier-column", 1),
            Paths.get(string("output.qr-dir", "QR_codes")),
            pdfDirectory,
            "none".equalsIgnoreCase(failureReport) ? null : pdfDirectory.resolve(failureReport),
            intValue("pipeline.workers", Runtime.getRuntime().availableProcessors()),
            Boolean.parseBoolean(string("pipeline.qr-only", "false")),
            pathList(string("fonts.dirs", null)),
            fontFiles(string("fonts.files", null)),
            qrConfig,
            pageConfig);
    }

    String string(String key, String defaultValue) {
        String value = firstNonBlank(
            systemProperties.apply(SYSTEM_PREFIX + key),
            environment.apply(envName(key)),
            fileProps.getProperty(key));
        return value != null ? value : defaultValue;
    }

    private int intValue(String key, int defaultValue) {
        String raw = string(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidConfigException("Setting " + key + " must be an integer, was '" + raw + "'");
        }
    }

    private float floatValue(String key, float defaultValue) {
        String raw = string(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidConfigException("Setting " + key + " must be a number, was '" + raw + "'");
        }
    }

    private static ErrorCorrection errorCorrection(String raw) {
        try {
            return ErrorCorrection.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigException("QR error correction must be one of L, M, Q, H, was '" + raw + "'");
        }
    }

    private static List<Path> pathList(String raw) {
        List<Path> paths = new ArrayList<>();
        if (raw == null) {
            return paths;
        }
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                paths.add(Paths.get(trimmed));
            }
        }
        return paths;
    }

    /**
     * Parses {@code Name=path/to/font.ttf,Other=...}.
     */
    private static Map<String, Path> fontFiles(String raw) {
        Map<String, Path> fonts = new LinkedHashMap<>();
        if (raw == null) {
            return fonts;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new InvalidConfigException("Font registration must be 'Name=path', was '" + trimmed + "'");
            }
            fonts.put(trimmed.substring(0, eq).trim(), Paths.get(trimmed.substring(eq + 1).trim()));
        }
        return fonts;
    }

    static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static Properties loadFileProperties(Path explicitFile) throws IOException {
        Properties props = new Properties();
        Path file = explicitFile;
        if (file == null) {
            String named = System.getProperty(CONFIG_FILE_PROPERTY);
            if (named != null && !named.isBlank()) {
                file = Paths.get(named.trim());
            }
        }

        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            LOGGER.fine("Loaded settings from " + file);
            return props;
        }

        try (InputStream stream = SettingsLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_FILE)) {
            if (stream != null) {
                props.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
            }
        } catch (IOException ex) {
            LOGGER.warning("Ignoring unreadable " + CLASSPATH_FILE + ": " + ex.getMessage());
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
