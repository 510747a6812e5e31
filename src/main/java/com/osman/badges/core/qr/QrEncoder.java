package com.osman.badges.core.qr;

import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageConfig;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import com.osman.badges.core.fs.AtomicFileWriter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes identifiers into QR rasters.
 * <p>
 * The encoding mode (numeric, alphanumeric or byte) follows the characters of the data. Byte
 * mode uses ISO-8859-1 when possible and UTF-8 otherwise. The symbol uses the configured version
 * unless the data needs a larger one, in which case the smallest version that fits is chosen.
 */
public final class QrEncoder {

    /**
     * Builds the QR raster for {@code data}. Identical inputs always produce identical pixels.
     *
     * @throws EncodingCapacityException if the data exceeds version 40 capacity at the
     *                                   configured error-correction level
     */
    public BufferedImage encode(String data, QrConfig config) throws EncodingCapacityException {
        return render(encodeSymbol(data, config), config);
    }

    /**
     * Encodes the symbol without rasterizing it, so callers can inspect the chosen version.
     */
    public QRCode encodeSymbol(String data, QrConfig config) throws EncodingCapacityException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(config, "config");

        Map<EncodeHintType, Object> hints = baseHints(data);
        QRCode minimal;
        try {
            minimal = Encoder.encode(data, config.errorCorrection().zxingLevel(), hints);
        } catch (WriterException ex) {
            throw new EncodingCapacityException(
                "Data of length %d does not fit a QR symbol at error correction %s"
                    .formatted(data.length(), config.errorCorrection()),
                ex);
        }
        if (minimal.getVersion().getVersionNumber() >= config.version()) {
            return minimal;
        }

        hints.put(EncodeHintType.QR_VERSION, config.version());
        try {
            return Encoder.encode(data, config.errorCorrection().zxingLevel(), hints);
        } catch (WriterException ex) {
            // a larger version than the minimal one always fits
            throw new IllegalStateException("QR encoding failed at version " + config.version(), ex);
        }
    }

    /**
     * Writes the raster as PNG. The file appears only once fully written.
     */
    public Path writePng(BufferedImage image, Path target) throws IOException {
        Objects.requireNonNull(image, "image");
        return AtomicFileWriter.write(target, tmp -> {
            if (!ImageIO.write(image, "png", tmp.toFile())) {
                throw new IOException("No PNG writer available");
            }
        });
    }

    /**
     * Side length in pixels of the raster for a symbol of the given version.
     */
    public static int rasterSize(int version, QrConfig config) {
        int modules = version * 4 + 17;
        return (modules + 2 * config.border()) * config.boxSize();
    }

    private static Map<EncodeHintType, Object> baseHints(String data) {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        if (!StandardCharsets.ISO_8859_1.newEncoder().canEncode(data)) {
            hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        }
        return hints;
    }

    private static BufferedImage render(QRCode code, QrConfig config) {
        ByteMatrix symbol = code.getMatrix();
        int modules = symbol.getWidth();
        int box = config.boxSize();
        int offset = config.border() * box;
        int size = (modules + 2 * config.border()) * box;

        BitMatrix matrix = new BitMatrix(size, size);
        for (int y = 0; y < modules; y++) {
            for (int x = 0; x < modules; x++) {
                if (symbol.get(x, y) == 1) {
                    matrix.setRegion(offset + x * box, offset + y * box, box, box);
                }
            }
        }
        MatrixToImageConfig colors = new MatrixToImageConfig(config.fillColor().getRGB(), config.backColor().getRGB());
        return MatrixToImageWriter.toBufferedImage(matrix, colors);
    }
}
