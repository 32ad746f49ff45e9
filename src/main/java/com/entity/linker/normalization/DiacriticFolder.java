package com.entity.linker.normalization;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;

/**
 * Folds accented Latin letters to their base letters while leaving every other script intact.
 *
 * <p>Combining marks are only removed when they follow a Latin base character, so
 * Devanagari vowel signs or Japanese voicing marks are kept. Letters that Unicode
 * does not decompose (ß, æ, ø, ł, ...) are mapped explicitly.</p>
 */
final class DiacriticFolder {

    private static final Map<Integer, String> LETTER_FOLDS = Map.ofEntries(
            Map.entry((int) 'ß', "ss"),
            Map.entry((int) 'æ', "ae"),
            Map.entry((int) 'ø', "o"),
            Map.entry((int) 'œ', "oe"),
            Map.entry((int) 'đ', "d"),
            Map.entry((int) 'ł', "l"),
            Map.entry((int) 'þ', "th"),
            Map.entry((int) 'ð', "d"),
            Map.entry((int) 'ı', "i"),
            Map.entry((int) 'ħ', "h"),
            Map.entry((int) 'ŋ', "n")
    );

    private DiacriticFolder() {
        // Utility class
    }

    /**
     * Lowercases and folds the input. The result is in NFC form.
     */
    static String foldAndLowercase(String input) {
        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFKD);
        StringBuilder stripped = new StringBuilder(decomposed.length());
        boolean afterLatin = false;
        for (int i = 0; i < decomposed.length(); ) {
            int cp = decomposed.codePointAt(i);
            i += Character.charCount(cp);
            if (isCombiningMark(cp)) {
                if (!afterLatin) {
                    stripped.appendCodePoint(cp);
                }
                continue;
            }
            afterLatin = Character.UnicodeScript.of(cp) == Character.UnicodeScript.LATIN;
            stripped.appendCodePoint(cp);
        }

        String lower = stripped.toString().toLowerCase(Locale.ROOT);
        StringBuilder folded = new StringBuilder(lower.length());
        lower.codePoints().forEach(cp -> {
            String replacement = LETTER_FOLDS.get(cp);
            if (replacement != null) {
                folded.append(replacement);
            } else if (!isCombiningMarkAfterLatin(folded, cp)) {
                folded.appendCodePoint(cp);
            }
        });
        return Normalizer.normalize(folded, Normalizer.Form.NFC);
    }

    private static boolean isCombiningMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    // Lowercasing can emit new marks, e.g. U+0130 becomes i + U+0307
    private static boolean isCombiningMarkAfterLatin(StringBuilder folded, int cp) {
        if (!isCombiningMark(cp) || folded.length() == 0) {
            return false;
        }
        int previous = folded.codePointBefore(folded.length());
        return Character.UnicodeScript.of(previous) == Character.UnicodeScript.LATIN;
    }
}
