package com.osman.badges.core.text;

import com.ibm.icu.text.ArabicShaping;
import com.ibm.icu.text.ArabicShapingException;
import com.ibm.icu.text.Bidi;

/**
 * Converts logical-order text into the visual order expected by a renderer that simply lays
 * glyphs out left to right, such as a PDF content stream.
 * <p>
 * Arabic-script letters, Persian ones included, are first replaced by their contextual
 * presentation forms, then the Unicode bidirectional algorithm reorders right-to-left runs.
 * Text that contains no right-to-left content is returned unchanged.
 */
public final class TextShaper {

    private static final int SHAPING_OPTIONS = ArabicShaping.LETTERS_SHAPE
        | ArabicShaping.TEXT_DIRECTION_LOGICAL
        | ArabicShaping.LENGTH_GROW_SHRINK;

    private final ArabicShaping arabicShaping = new ArabicShaping(SHAPING_OPTIONS);

    /**
     * Shapes and reorders the given text.
     *
     * @param rawText text in logical (reading) order
     * @return text in visual order
     * @throws TextShapingException if the text contains an unpaired surrogate or shaping fails
     */
    public String shape(String rawText) throws TextShapingException {
        if (rawText == null || rawText.isEmpty()) {
            return rawText == null ? "" : rawText;
        }
        verifyWellFormed(rawText);

        char[] chars = rawText.toCharArray();
        if (!Bidi.requiresBidi(chars, 0, chars.length)) {
            return rawText;
        }

        String shaped;
        try {
            shaped = PersianLetterForms.apply(rawText, arabicShaping.shape(rawText));
        } catch (ArabicShapingException ex) {
            throw new TextShapingException("Unable to shape text: " + ex.getMessage(), ex);
        }

        Bidi bidi = new Bidi(shaped, Bidi.DIRECTION_DEFAULT_LEFT_TO_RIGHT);
        return bidi.writeReordered(Bidi.DO_MIRRORING);
    }

    private static void verifyWellFormed(String text) throws TextShapingException {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new TextShapingException("Unpaired high surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw new TextShapingException("Unpaired low surrogate at index " + i);
            }
        }
    }
}
