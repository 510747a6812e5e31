package com.osman.badges.core.qr;

import com.osman.badges.core.InvalidConfigException;

import java.awt.Color;
import java.util.Objects;

/**
 * QR symbol and raster settings shared by every record of a run.
 *
 * @param version         minimum symbol version (1..40); larger versions are used when the data
 *                        does not fit
 * @param errorCorrection error-correction level
 * @param boxSize         pixels per module edge
 * @param border          quiet-zone width in modules
 * @param fillColor       color of dark modules
 * @param backColor       color of light modules and the quiet zone
 */
public record QrConfig(int version,
                       ErrorCorrection errorCorrection,
                       int boxSize,
                       int border,
                       Color fillColor,
                       Color backColor) {

    public static final int MIN_VERSION = 1;
    public static final int MAX_VERSION = 40;

    public QrConfig {
        if (version < MIN_VERSION || version > MAX_VERSION) {
            throw new InvalidConfigException("QR version must be between 1 and 40, was " + version);
        }
        if (errorCorrection == null) {
            throw new InvalidConfigException("QR error correction level is required");
        }
        if (boxSize <= 0) {
            throw new InvalidConfigException("QR box size must be positive, was " + boxSize);
        }
        if (border < 0) {
            throw new InvalidConfigException("QR border must not be negative, was " + border);
        }
        if (fillColor == null || backColor == null) {
            throw new InvalidConfigException("QR fill and back colors are required");
        }
    }

    /**
     * Version 3, level L, 10 pixel modules, 4 module border, black on white.
     */
    public static QrConfig defaults() {
        return new QrConfig(3, ErrorCorrection.L, 10, 4, Color.BLACK, Color.WHITE);
    }

    public QrConfig withVersion(int newVersion) {
        return new QrConfig(newVersion, errorCorrection, boxSize, border, fillColor, backColor);
    }

    public QrConfig withErrorCorrection(ErrorCorrection level) {
        return new QrConfig(version, Objects.requireNonNull(level, "level"), boxSize, border, fillColor, backColor);
    }

    public QrConfig withBoxSize(int newBoxSize) {
        return new QrConfig(version, errorCorrection, newBoxSize, border, fillColor, backColor);
    }

    public QrConfig withBorder(int newBorder) {
        return new QrConfig(version, errorCorrection, boxSize, newBorder, fillColor, backColor);
    }

    public QrConfig withColors(Color fill, Color back) {
        return new QrConfig(version, errorCorrection, boxSize, border, fill, back);
    }
}
