package com.phillippitts.speaktomany.util;

/** Utility for privacy-safe logging of transcript and translation previews. */
public final class LogSanitizer {

    /** Default preview length for transcript text in logs. */
    public static final int PREVIEW_CHARS = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short single-line preview of spoken text: newlines collapsed, truncated to
     * {@link #PREVIEW_CHARS} with a trailing ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= PREVIEW_CHARS ? flat : truncate(flat, PREVIEW_CHARS) + "...";
    }
}
