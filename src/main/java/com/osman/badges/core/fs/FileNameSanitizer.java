package com.osman.badges.core.fs;

/**
 * Keeps display names usable as file names. Only characters that common filesystems reject are
 * replaced; letters of every script are kept as-is.
 */
final class FileNameSanitizer {

    private FileNameSanitizer() {
    }

    static String sanitize(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '/', '\\', ':', '*', '?', '"', '<', '>', '|' -> builder.append('-');
                default -> builder.append(Character.isISOControl(c) ? '-' : c);
            }
        }
        return builder.toString();
    }
}
