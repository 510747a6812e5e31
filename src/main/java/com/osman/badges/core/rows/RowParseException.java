package com.osman.badges.core.rows;

import com.osman.badges.core.BadgeException;

/**
 * Raised when an input row lacks a column the badge record needs.
 */
public class RowParseException extends BadgeException {
    private final int rowIndex;

    public RowParseException(int rowIndex, String message) {
        super("Row " + rowIndex + ": " + message);
        this.rowIndex = rowIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
