package com.osman.badges.core;

/**
 * Raised when a QR or page configuration value is out of range. Configuration is shared
 * by every record, so this aborts a run before any record is processed.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
