package com.osman.badges.core.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Files written for one successfully processed record. The PDF path is empty when the
 * pipeline runs in QR-only mode.
 */
public record GeneratedArtifact(int rowIndex, Path qrImagePath, Optional<Path> pdfPath) {

    public GeneratedArtifact {
        Objects.requireNonNull(qrImagePath, "qrImagePath");
        Objects.requireNonNull(pdfPath, "pdfPath");
    }

    public static GeneratedArtifact qrOnly(int rowIndex, Path qrImagePath) {
        return new GeneratedArtifact(rowIndex, qrImagePath, Optional.empty());
    }

    public static GeneratedArtifact withPdf(int rowIndex, Path qrImagePath, Path pdfPath) {
        return new GeneratedArtifact(rowIndex, qrImagePath, Optional.of(pdfPath));
    }
}
