package com.osman.badges.core;

/**
 * Base type for failures that affect a single badge record.
 */
public abstract class BadgeException extends Exception {

    protected BadgeException(String message) {
        super(message);
    }

    protected BadgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
