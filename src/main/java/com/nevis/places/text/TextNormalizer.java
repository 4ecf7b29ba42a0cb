package com.nevis.places.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form used for both catalog terms and queries: NFD decomposed,
 * combining marks removed, lower-cased and trimmed.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("")
            .toLowerCase(Locale.ROOT)
            .trim();
    }

    /**
     * Offsets of the words that follow a separator in already normalized text,
     * e.g. {@code "saint-jean-sur-richelieu"} yields the offsets of "jean", "sur"
     * and "richelieu". Offset 0 is never included.
     */
    public static List<Integer> wordStarts(String normalized) {
        List<Integer> offsets = new ArrayList<>();
        for (int i = 1; i < normalized.length(); i++) {
            if (Character.isLetterOrDigit(normalized.charAt(i))
                && !Character.isLetterOrDigit(normalized.charAt(i - 1))) {
                offsets.add(i);
            }
        }
        return offsets;
    }
}
