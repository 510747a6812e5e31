package com.osman.badges.core.qr;

import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

import java.util.Locale;

/**
 * QR error-correction tiers, from most payload capacity (L) to most damage resilience (H).
 */
public enum ErrorCorrection {
    L(ErrorCorrectionLevel.L),
    M(ErrorCorrectionLevel.M),
    Q(ErrorCorrectionLevel.Q),
    H(ErrorCorrectionLevel.H);

    private final ErrorCorrectionLevel zxingLevel;

    ErrorCorrection(ErrorCorrectionLevel zxingLevel) {
        this.zxingLevel = zxingLevel;
    }

    ErrorCorrectionLevel zxingLevel() {
        return zxingLevel;
    }

    public static ErrorCorrection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Error correction level is blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
