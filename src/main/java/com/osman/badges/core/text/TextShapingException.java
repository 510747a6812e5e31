package com.osman.badges.core.text;

import com.osman.badges.core.BadgeException;

/**
 * Raised when a display name is not well-formed Unicode or cannot be shaped.
 */
public class TextShapingException extends BadgeException {

    public TextShapingException(String message) {
        super(message);
    }

    public TextShapingException(String message, Throwable cause) {
        super(message, cause);
    }
}
