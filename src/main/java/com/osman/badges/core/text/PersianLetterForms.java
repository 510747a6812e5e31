package com.osman.badges.core.text;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contextual forms for the Persian letters that {@link com.ibm.icu.text.ArabicShaping} leaves
 * untouched because their presentation forms live in the Arabic Presentation Forms-A block.
 * <p>
 * The form of each letter is chosen from its neighbours in the logical text, skipping
 * transparent marks such as harakat, and substituted into the ICU output occurrence by
 * occurrence.
 */
final class PersianLetterForms {

    private static final int ISOLATED = 0;
    private static final int FINAL = 1;
    private static final int INITIAL = 2;
    private static final int MEDIAL = 3;
    private static final int FORM_COUNT_DUAL = 4;

    // isolated, final, initial, medial
    private static final Map<Character, char[]> FORMS = Map.of(
        '\u067E', new char[] {'\uFB56', '\uFB57', '\uFB58', '\uFB59'}, // peh
        '\u0686', new char[] {'\uFB7A', '\uFB7B', '\uFB7C', '\uFB7D'}, // tcheh
        '\u0698', new char[] {'\uFB8A', '\uFB8B'}, // jeh, joins on the right only
        '\u06A9', new char[] {'\uFB8E', '\uFB8F', '\uFB90', '\uFB91'}, // keheh
        '\u06AF', new char[] {'\uFB92', '\uFB93', '\uFB94', '\uFB95'}, // gaf
        '\u06CC', new char[] {'\uFBFC', '\uFBFD', '\uFBFE', '\uFBFF'}  // farsi yeh
    );

    private PersianLetterForms() {
    }

    /**
     * @param logical text before shaping, in logical order
     * @param shaped  ICU output for {@code logical}, still in logical order
     * @return {@code shaped} with every Persian letter replaced by its contextual form
     */
    static String apply(String logical, String shaped) {
        Map<Character, List<Character>> formsByLetter = new HashMap<>();
        for (int i = 0; i < logical.length(); i++) {
            char[] forms = FORMS.get(logical.charAt(i));
            if (forms != null) {
                formsByLetter.computeIfAbsent(logical.charAt(i), k -> new ArrayList<>())
                    .add(forms[formIndex(logical, i, forms.length)]);
            }
        }
        if (formsByLetter.isEmpty()) {
            return shaped;
        }

        StringBuilder out = new StringBuilder(shaped);
        for (Map.Entry<Character, List<Character>> entry : formsByLetter.entrySet()) {
            char letter = entry.getKey();
            List<Character> forms = entry.getValue();
            if (count(shaped, letter) != forms.size()) {
                // ICU already shaped this letter itself
                continue;
            }
            int next = 0;
            for (int i = 0; i < out.length(); i++) {
                if (out.charAt(i) == letter) {
                    out.setCharAt(i, forms.get(next++));
                }
            }
        }
        return out.toString();
    }

    private static int formIndex(String text, int index, int formCount) {
        boolean joinsPrevious = linksForward(neighbour(text, index, -1));
        boolean joinsNext = formCount == FORM_COUNT_DUAL && linksBackward(neighbour(text, index, 1));
        if (joinsPrevious && joinsNext) {
            return MEDIAL;
        }
        if (joinsNext) {
            return INITIAL;
        }
        return joinsPrevious ? FINAL : ISOLATED;
    }

    /**
     * Nearest character in the given direction that is not a transparent mark, or -1.
     */
    private static int neighbour(String text, int index, int step) {
        for (int i = index + step; i >= 0 && i < text.length(); i += step) {
            char c = text.charAt(i);
            if (joiningType(c) != UCharacter.JoiningType.TRANSPARENT) {
                return c;
            }
        }
        return -1;
    }

    private static boolean linksForward(int c) {
        if (c < 0) {
            return false;
        }
        int type = joiningType(c);
        return type == UCharacter.JoiningType.DUAL_JOINING
            || type == UCharacter.JoiningType.LEFT_JOINING
            || type == UCharacter.JoiningType.JOIN_CAUSING;
    }

    private static boolean linksBackward(int c) {
        if (c < 0) {
            return false;
        }
        int type = joiningType(c);
        return type == UCharacter.JoiningType.DUAL_JOINING
            || type == UCharacter.JoiningType.RIGHT_JOINING
            || type == UCharacter.JoiningType.JOIN_CAUSING;
    }

    private static int joiningType(int c) {
        return UCharacter.getIntPropertyValue(c, UProperty.JOINING_TYPE);
    }

    private static int count(String text, char letter) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == letter) {
                count++;
            }
        }
        return count;
    }
}
