package com.osman.badges.core.pdf;

import com.osman.badges.core.InvalidConfigException;

/**
 * Text color as red, green and blue components in {@code [0, 1]}.
 */
public record RgbColor(float red, float green, float blue) {

    public static final RgbColor BLACK = new RgbColor(0f, 0f, 0f);

    public RgbColor {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Parses {@code "r,g,b"} with float components in {@code [0, 1]}, or {@code "#RRGGBB"}.
     */
    public static RgbColor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigException("Color value is blank");
        }
        String value = raw.trim();
        try {
            if (value.startsWith("#") && value.length() == 7) {
                int rgb = Integer.parseInt(value.substring(1), 16);
                return new RgbColor(((rgb >> 16) & 0xFF) / 255f, ((rgb >> 8) & 0xFF) / 255f, (rgb & 0xFF) / 255f);
            }
            String[] parts = value.split(",");
            if (parts.length == 3) {
                return new RgbColor(
                    Float.parseFloat(parts[0].trim()),
                    Float.parseFloat(parts[1].trim()),
                    Float.parseFloat(parts[2].trim()));
            }
        } catch (NumberFormatException ex) {
            throw new InvalidConfigException("Unparseable color: " + raw);
        }
        throw new InvalidConfigException("Color must be 'r,g,b' or '#RRGGBB': " + raw);
    }

    private static void checkComponent(String name, float value) {
        if (!(value >= 0f && value <= 1f)) {
            throw new InvalidConfigException("Color component " + name + " must be within [0, 1], was " + value);
        }
    }
}
