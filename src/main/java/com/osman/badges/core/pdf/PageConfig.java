package com.osman.badges.core.pdf;

import com.osman.badges.core.InvalidConfigException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Page geometry, fonts and offsets used for every badge of a run. Sizes are in PDF points.
 * Vertical offsets are measured downwards from an anchor that sits
 * {@link PageComposer#TOP_MARGIN} points below the top edge.
 *
 * @param backgroundAsset optional image stretched over the whole page; {@code null} for none
 */
public record PageConfig(float pageWidth,
                         float pageHeight,
                         Path backgroundAsset,
                         String titleFont,
                         float titleFontSize,
                         RgbColor titleColor,
                         String numberFont,
                         float numberFontSize,
                         RgbColor numberColor,
                         float qrSize,
                         float titleYOffset,
                         float qrYOffset,
                         float numberYOffset) {

    public PageConfig {
        if (!(pageWidth > 0) || !(pageHeight > 0)) {
            throw new InvalidConfigException("Page size must be positive, was %s x %s".formatted(pageWidth, pageHeight));
        }
        if (titleFont == null || titleFont.isBlank() || numberFont == null || numberFont.isBlank()) {
            throw new InvalidConfigException("Title and number fonts are required");
        }
        if (!(titleFontSize > 0) || !(numberFontSize > 0)) {
            throw new InvalidConfigException("Font sizes must be positive");
        }
        if (titleColor == null || numberColor == null) {
            throw new InvalidConfigException("Title and number colors are required");
        }
        if (!(qrSize > 0) || qrSize > Math.min(pageWidth, pageHeight)) {
            throw new InvalidConfigException(
                "QR size must be positive and fit the page, was %s on %s x %s".formatted(qrSize, pageWidth, pageHeight));
        }
        if (titleYOffset < 0 || qrYOffset < 0 || numberYOffset < 0) {
            throw new InvalidConfigException("Vertical offsets must not be negative");
        }
    }

    /**
     * 300 x 400 points, Helvetica 16 title, Helvetica 12 number, 150 point QR, offsets 0/10/30.
     */
    public static PageConfig defaults() {
        return new PageConfig(300f, 400f, null,
            "Helvetica", 16f, RgbColor.BLACK,
            "Helvetica", 12f, RgbColor.BLACK,
            150f, 0f, 10f, 30f);
    }

    public Optional<Path> background() {
        return Optional.ofNullable(backgroundAsset);
    }

    public PageConfig withBackground(Path background) {
        return new PageConfig(pageWidth, pageHeight, background, titleFont, titleFontSize, titleColor,
            numberFont, numberFontSize, numberColor, qrSize, titleYOffset, qrYOffset, numberYOffset);
    }

    public PageConfig withTitleFont(String font, float size) {
        return new PageConfig(pageWidth, pageHeight, backgroundAsset, font, size, titleColor,
            numberFont, numberFontSize, numberColor, qrSize, titleYOffset, qrYOffset, numberYOffset);
    }

    public PageConfig withNumberFont(String font, float size) {
        return new PageConfig(pageWidth, pageHeight, backgroundAsset, titleFont, titleFontSize, titleColor,
            font, size, numberColor, qrSize, titleYOffset, qrYOffset, numberYOffset);
    }
}
