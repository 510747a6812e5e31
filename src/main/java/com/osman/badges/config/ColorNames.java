package com.osman.badges.config;

import com.osman.badges.core.InvalidConfigException;

import java.awt.Color;
import java.util.Locale;
import java.util.Map;

/**
 * Parses QR module colors given as a common color name or {@code #RRGGBB}.
 */
final class ColorNames {

    private static final Map<String, Color> NAMED = Map.ofEntries(
        Map.entry("black", Color.BLACK),
        Map.entry("white", Color.WHITE),
        Map.entry("red", Color.RED),
        Map.entry("green", Color.GREEN),
        Map.entry("blue", Color.BLUE),
        Map.entry("navy", new Color(0x000080)),
        Map.entry("gray", Color.GRAY),
        Map.entry("grey", Color.GRAY),
        Map.entry("darkgray", Color.DARK_GRAY),
        Map.entry("lightgray", Color.LIGHT_GRAY),
        Map.entry("yellow", Color.YELLOW),
        Map.entry("orange", Color.ORANGE),
        Map.entry("magenta", Color.MAGENTA),
        Map.entry("cyan", Color.CYAN)
    );

    private ColorNames() {
    }

    static Color parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigException("Color value is blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        Color named = NAMED.get(value);
        if (named != null) {
            return named;
        }
        if (value.startsWith("#") && value.length() == 7) {
            try {
                return new Color(Integer.parseInt(value.substring(1), 16));
            } catch (NumberFormatException ex) {
                throw new InvalidConfigException("Unparseable color: " + raw);
            }
        }
        throw new InvalidConfigException("Unknown color '" + raw + "' (use a color name or #RRGGBB)");
    }
}
