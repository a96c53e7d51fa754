package com.vidnyan.guard.domain.verdict;

/**
 * Display truncation that never splits a character.
 */
public final class TextTruncation {

    static final String ELLIPSIS = "...";

    /**
     * Cut {@code text} to at most {@code maxChars} UTF-16 units (plus an
     * ellipsis). If the cut would fall inside a surrogate pair, the whole
     * code point is dropped.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0) {
            return text.isEmpty() ? "" : ELLIPSIS;
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1)) && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }

    private TextTruncation() {}
}
