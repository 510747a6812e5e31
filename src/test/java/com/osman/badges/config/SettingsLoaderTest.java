package com.osman.badges.config;

import com.osman.badges.core.InvalidConfigException;
import com.osman.badges.core.qr.ErrorCorrection;
import com.osman.badges.core.pdf.RgbColor;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsLoaderTest {

    @Test
    void defaultsApplyWhenNothingIsConfigured() {
        GeneratorSettings settings = loader(new Properties(), Map.of(), Map.of()).resolve();

        assertTrue(settings.input().isEmpty());
        assertEquals(1, settings.skipRows());
        assertEquals(0, settings.nameColumn());
        assertEquals(1, settings.identifierColumn());
        assertEquals(Paths.get("QR_codes"), settings.qrDirectory());
        assertEquals(Paths.get("PDF_files"), settings.pdfDirectory());
        assertEquals(Paths.get("PDF_files", "generation-failures.csv"), settings.failureReport());
        assertFalse(settings.qrOnly());
        assertTrue(settings.workers() >= 1);
        assertEquals(3, settings.qrConfig().version());
        assertEquals(ErrorCorrection.L, settings.qrConfig().errorCorrection());
        assertEquals(10, settings.qrConfig().boxSize());
        assertEquals(4, settings.qrConfig().border());
        assertEquals(300f, settings.pageConfig().pageWidth());
        assertEquals("Helvetica", settings.pageConfig().titleFont());
        assertTrue(settings.fontDirectories().isEmpty());
        assertTrue(settings.fontFiles().isEmpty());
    }

    @Test
    void systemPropertyBeatsEnvironmentBeatsFile() {
        Properties file = new Properties();
        file.setProperty("qr.box-size", "5");
        file.setProperty("qr.border", "2");
        file.setProperty("page.qr-size", "120");

        Map<String, String> env = new HashMap<>();
        env.put("BADGES_QR_BOX_SIZE", "6");
        env.put("BADGES_QR_BORDER", "3");

        Map<String, String> sys = new HashMap<>();
        sys.put("badges.qr.box-size", "7");

        GeneratorSettings settings = loader(file, sys, env).resolve();

        assertEquals(7, settings.qrConfig().boxSize());
        assertEquals(3, settings.qrConfig().border());
        assertEquals(120f, settings.pageConfig().qrSize());
    }

    @Test
    void blankValuesFallThrough() {
        Properties file = new Properties();
        file.setProperty("output.qr-dir", "out/qr");

        GeneratorSettings settings = loader(file, Map.of("badges.output.qr-dir", "  "), Map.of()).resolve();

        assertEquals(Paths.get("out/qr"), settings.qrDirectory());
    }

    @Test
    void readsColorsFontsAndReportSettings() {
        Properties file = new Properties();
        file.setProperty("qr.fill-color", "navy");
        file.setProperty("qr.back-color", "#FFFF00");
        file.setProperty("qr.error-correction", "h");
        file.setProperty("page.title.color", "#FF0000");
        file.setProperty("page.background", "assets/bg.svg");
        file.setProperty("fonts.dirs", "fonts, more-fonts ,");
        file.setProperty("fonts.files", "BNazanin=fonts/BNazanin.ttf, Vazir = fonts/Vazir.ttf");
        file.setProperty("output.failure-report", "NONE");
        file.setProperty("pipeline.qr-only", "true");
        file.setProperty("pipeline.workers", "3");

        GeneratorSettings settings = loader(file, Map.of(), Map.of()).resolve();

        assertEquals(new Color(0x000080), settings.qrConfig().fillColor());
        assertEquals(Color.YELLOW, settings.qrConfig().backColor());
        assertEquals(ErrorCorrection.H, settings.qrConfig().errorCorrection());
        assertEquals(new RgbColor(1f, 0f, 0f), settings.pageConfig().titleColor());
        assertEquals(Paths.get("assets/bg.svg"), settings.pageConfig().background().orElseThrow());
        assertEquals(List.of(Paths.get("fonts"), Paths.get("more-fonts")), settings.fontDirectories());
        assertEquals(Map.of("BNazanin", Paths.get("fonts/BNazanin.ttf"), "Vazir", Paths.get("fonts/Vazir.ttf")),
            settings.fontFiles());
        assertNull(settings.failureReport());
        assertTrue(settings.qrOnly());
        assertEquals(3, settings.workers());
        assertNull(settings.toPipelineOptions().failureReport());
    }

    @Test
    void failureReportIsResolvedInsidePdfDirectory() {
        Properties file = new Properties();
        file.setProperty("output.pdf-dir", "out/pages");
        file.setProperty("output.failure-report", "errors.csv");

        GeneratorSettings settings = loader(file, Map.of(), Map.of()).resolve();

        assertEquals(Paths.get("out", "pages", "errors.csv"), settings.failureReport());
        assertEquals(Paths.get("out", "pages", "errors.csv"), settings.toPipelineOptions().failureReport());
    }

    @Test
    void absoluteFailureReportIsKept() {
        Path absolute = Paths.get("reports", "failures.csv").toAbsolutePath();
        Properties file = new Properties();
        file.setProperty("output.failure-report", absolute.toString());

        GeneratorSettings settings = loader(file, Map.of(), Map.of()).resolve();

        assertEquals(absolute, settings.failureReport());
    }

    @Test
    void malformedValuesAreRejected() {
        assertInvalid("qr.version", "three");
        assertInvalid("qr.version", "41");
        assertInvalid("qr.error-correction", "X");
        assertInvalid("qr.fill-color", "sparkly");
        assertInvalid("page.width", "wide");
        assertInvalid("fonts.files", "NoPath");
        assertInvalid("pipeline.workers", "0");
    }

    @Test
    void environmentNamesAreDerivedFromKeys() {
        assertEquals("BADGES_PAGE_TITLE_FONT_SIZE", SettingsLoader.envName("page.title.font-size"));
        assertEquals("BADGES_INPUT_FILE", SettingsLoader.envName("input.file"));
    }

    @Test
    void withInputFileKeepsOtherSettings() {
        GeneratorSettings settings = loader(new Properties(), Map.of(), Map.of()).resolve()
            .withInputFile(Path.of("names.csv"));

        assertEquals(Path.of("names.csv"), settings.input().orElseThrow());
        assertEquals(1, settings.skipRows());
    }

    private static void assertInvalid(String key, String value) {
        Properties file = new Properties();
        file.setProperty(key, value);
        assertThrows(InvalidConfigException.class, () -> loader(file, Map.of(), Map.of()).resolve().toPipelineOptions(),
            key + "=" + value);
    }

    private static SettingsLoader loader(Properties file, Map<String, String> sys, Map<String, String> env) {
        return new SettingsLoader(file, sys::get, env::get);
    }
}
