package org.muralis.maps.util;

import java.util.regex.Pattern;

/**
 * Cleans provider-supplied instruction text for plain-text consumers.
 */
public final class TextNormalizer {

    private static final Pattern MARKUP = Pattern.compile("<.*?>");
    private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");

    private TextNormalizer() {
    }

    /**
     * Replaces every {@code <...>} tag with a space, collapses repeated spaces and trims the result.
     * A tag between two words (e.g. {@code Main St<div>Toll road</div>}) still leaves them separated.
     */
    public static String stripMarkup(String text) {
        if (text == null) {
            return "";
        }
        String withoutTags = MARKUP.matcher(text).replaceAll(" ");
        return REPEATED_SPACES.matcher(withoutTags).replaceAll(" ").trim();
    }
}
