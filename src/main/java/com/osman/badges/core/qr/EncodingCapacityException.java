package com.osman.badges.core.qr;

import com.osman.badges.core.BadgeException;

/**
 * Raised when data does not fit even the largest QR version at the configured
 * error-correction level.
 */
public class EncodingCapacityException extends BadgeException {

    public EncodingCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
