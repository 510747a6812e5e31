package com.osman.badges.core.pdf;

import com.osman.badges.core.BadgeException;

/**
 * Raised when a page refers to a font name that was never registered with the {@link FontRegistry}.
 */
public class UnknownFontException extends BadgeException {
    private final String fontName;

    public UnknownFontException(String fontName) {
        super("Font is not registered: " + fontName);
        this.fontName = fontName;
    }

    public String getFontName() {
        return fontName;
    }
}
