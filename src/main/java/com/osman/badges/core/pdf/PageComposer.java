package com.osman.badges.core.pdf;

import com.osman.badges.core.fs.AtomicFileWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes one single-page badge PDF: optional background, title, QR image and identifier, all
 * centered horizontally.
 * <p>
 * PDF coordinates grow upwards from the bottom-left corner. Every element is placed relative to
 * an anchor {@link #TOP_MARGIN} points below the top edge: the title baseline sits
 * {@code titleYOffset} below it, the QR image's lower edge {@code qrSize + qrYOffset} below it
 * and the identifier baseline {@code qrSize + numberYOffset} below it.
 */
public final class PageComposer {

    public static final float TOP_MARGIN = 100f;

    private final FontRegistry fonts;
    private final BackgroundImageLoader backgroundLoader = new BackgroundImageLoader();

    public PageComposer(FontRegistry fonts) {
        this.fonts = Objects.requireNonNull(fonts, "fonts");
    }

    /**
     * Composes the page and writes it to {@code outputPath}. The file appears only once it has
     * been completely written.
     *
     * @param titleText   display name, already shaped into visual order
     * @param numberText  identifier printed below the QR image
     * @param qrImagePath PNG produced by the QR encoder
     * @throws AssetNotFoundException if the QR image, the background or a font file is missing
     * @throws UnknownFontException   if a configured font name is not registered
     * @throws IOException            if the document cannot be built or written
     */
    public void compose(Path outputPath,
                        String titleText,
                        String numberText,
                        Path qrImagePath,
                        PageConfig config) throws AssetNotFoundException, UnknownFontException, IOException {
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(qrImagePath, "qrImagePath");
        Objects.requireNonNull(config, "config");
        if (!Files.isRegularFile(qrImagePath)) {
            throw new AssetNotFoundException("QR image", qrImagePath);
        }

        float width = config.pageWidth();
        float height = config.pageHeight();
        float xCenter = width / 2;
        float yAnchor = height - TOP_MARGIN;

        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(new PDRectangle(width, height));
            document.addPage(page);

            PDFont titleFont = fonts.resolve(document, config.titleFont());
            PDFont numberFont = fonts.resolve(document, config.numberFont());
            PDImageXObject background = null;
            if (config.background().isPresent()) {
                background = backgroundLoader.load(document, config.background().get(), width, height);
            }
            PDImageXObject qrImage = PDImageXObject.createFromFileByContent(qrImagePath.toFile(), document);

            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                if (background != null) {
                    stream.drawImage(background, 0, 0, width, height);
                }

                drawCentredString(stream, titleText, titleFont, config.titleFontSize(), config.titleColor(),
                    xCenter, yAnchor - config.titleYOffset());

                float qrSize = config.qrSize();
                stream.drawImage(qrImage, xCenter - qrSize / 2, yAnchor - qrSize - config.qrYOffset(), qrSize, qrSize);

                drawCentredString(stream, numberText, numberFont, config.numberFontSize(), config.numberColor(),
                    xCenter, yAnchor - qrSize - config.numberYOffset());
            }

            AtomicFileWriter.write(outputPath, tmp -> document.save(tmp.toFile()));
        }
    }

    private static void drawCentredString(PDPageContentStream stream,
                                          String text,
                                          PDFont font,
                                          float fontSize,
                                          RgbColor color,
                                          float xCenter,
                                          float baselineY) throws IOException {
        String safeText = text == null ? "" : text;
        float textWidth;
        try {
            textWidth = font.getStringWidth(safeText) / 1000 * fontSize;
        } catch (IllegalArgumentException ex) {
            throw new IOException("Font " + font.getName() + " cannot render '" + safeText + "': " + ex.getMessage(), ex);
        }
        stream.beginText();
        stream.setFont(font, fontSize);
        stream.setNonStrokingColor(color.red(), color.green(), color.blue());
        stream.newLineAtOffset(xCenter - textWidth / 2, baselineY);
        stream.showText(safeText);
        stream.endText();
    }
}
