package com.osman.badges.core.pdf;

import com.osman.badges.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Maps logical font names to fonts usable in a page.
 * <p>
 * The fourteen standard PDF fonts are always available under their PostScript names
 * ({@code Helvetica}, {@code Times-Bold}, ...). TrueType fonts are registered from files and
 * embedded, subsetted, into each document that uses them. Fonts with Arabic glyphs must be
 * registered this way because the standard fonts only cover Latin text.
 * <p>
 * Registration happens once before a run; lookups are safe from several worker threads.
 */
public final class FontRegistry {

    private static final Logger LOGGER = AppLogger.get();

    private static final Map<String, PDType1Font> STANDARD_FONTS = standardFonts();

    private final Map<String, Path> fontFiles = new ConcurrentHashMap<>();

    private FontRegistry() {
    }

    public static FontRegistry withStandardFonts() {
        return new FontRegistry();
    }

    /**
     * Registers a single TrueType font file under the given logical name.
     *
     * @throws IOException if the file does not exist or is not a .ttf/.otf file
     */
    public void registerFontFile(String name, Path fontFile) throws IOException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Font name is blank");
        }
        Objects.requireNonNull(fontFile, "fontFile");
        if (!Files.isRegularFile(fontFile)) {
            throw new IOException("Font file not found: " + fontFile);
        }
        if (!isFontFile(fontFile)) {
            throw new IOException("Unsupported font file (expected .ttf or .otf): " + fontFile);
        }
        Path previous = fontFiles.put(name.trim(), fontFile.toAbsolutePath());
        if (previous != null && !previous.equals(fontFile.toAbsolutePath())) {
            LOGGER.warning("Font '%s' re-registered: %s replaces %s".formatted(name, fontFile, previous));
        }
    }

    /**
     * Registers every .ttf/.otf file in the directory under its file name without extension,
     * e.g. {@code BNazanin.ttf} becomes {@code BNazanin}.
     *
     * @return number of fonts registered
     * @throws IOException if the directory is missing or holds no font files
     */
    public int loadFontsFromDirectory(Path fontDirectory) throws IOException {
        if (fontDirectory == null || !Files.isDirectory(fontDirectory)) {
            throw new IOException("Font folder not found or is not a directory: " + fontDirectory);
        }

        int loadedCount = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(fontDirectory, FontRegistry::isFontFile)) {
            for (Path fontFile : stream) {
                registerFontFile(baseName(fontFile), fontFile);
                loadedCount++;
            }
        }

        if (loadedCount == 0) {
            throw new IOException("No font files (.ttf, .otf) were found in: " + fontDirectory);
        }
        return loadedCount;
    }

    public boolean isRegistered(String name) {
        return name != null && (STANDARD_FONTS.containsKey(name) || fontFiles.containsKey(name));
    }

    public void requireRegistered(String name) throws UnknownFontException {
        if (!isRegistered(name)) {
            throw new UnknownFontException(name);
        }
    }

    /**
     * Logical names of fonts registered from files.
     */
    public Set<String> registeredFileFonts() {
        return Collections.unmodifiableSet(fontFiles.keySet());
    }

    /**
     * Resolves a font for use in {@code document}. File fonts are loaded into that document.
     */
    PDFont resolve(PDDocument document, String name) throws UnknownFontException, AssetNotFoundException, IOException {
        PDType1Font standard = name == null ? null : STANDARD_FONTS.get(name);
        if (standard != null) {
            return standard;
        }
        Path fontFile = name == null ? null : fontFiles.get(name);
        if (fontFile == null) {
            throw new UnknownFontException(name);
        }
        if (!Files.isRegularFile(fontFile)) {
            throw new AssetNotFoundException("Font file", fontFile);
        }
        return PDType0Font.load(document, fontFile.toFile());
    }

    private static boolean isFontFile(Path path) {
        String lowercase = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lowercase.endsWith(".ttf") || lowercase.endsWith(".otf");
    }

    private static String baseName(Path fontFile) {
        String fileName = fontFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static Map<String, PDType1Font> standardFonts() {
        Map<String, PDType1Font> fonts = new LinkedHashMap<>();
        fonts.put("Times-Roman", PDType1Font.TIMES_ROMAN);
        fonts.put("Times-Bold", PDType1Font.TIMES_BOLD);
        fonts.put("Times-Italic", PDType1Font.TIMES_ITALIC);
        fonts.put("Times-BoldItalic", PDType1Font.TIMES_BOLD_ITALIC);
        fonts.put("Helvetica", PDType1Font.HELVETICA);
        fonts.put("Helvetica-Bold", PDType1Font.HELVETICA_BOLD);
        fonts.put("Helvetica-Oblique", PDType1Font.HELVETICA_OBLIQUE);
        fonts.put("Helvetica-BoldOblique", PDType1Font.HELVETICA_BOLD_OBLIQUE);
        fonts.put("Courier", PDType1Font.COURIER);
        fonts.put("Courier-Bold", PDType1Font.COURIER_BOLD);
        fonts.put("Courier-Oblique", PDType1Font.COURIER_OBLIQUE);
        fonts.put("Courier-BoldOblique", PDType1Font.COURIER_BOLD_OBLIQUE);
        fonts.put("Symbol", PDType1Font.SYMBOL);
        fonts.put("ZapfDingbats", PDType1Font.ZAPF_DINGBATS);
        return Collections.unmodifiableMap(fonts);
    }
}
