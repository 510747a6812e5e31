package com.osman.badges.core.model;

import java.util.Objects;

/**
 * One input row after validation: the name printed on the badge, the identifier encoded in its
 * QR symbol, and the 1-based position of the row in the source file (header rows excluded).
 */
public record BadgeRecord(String displayName, String identifier, int rowIndex) {

    public BadgeRecord {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(identifier, "identifier");
        if (rowIndex < 1) {
            throw new IllegalArgumentException("rowIndex must be 1-based, was " + rowIndex);
        }
    }
}
