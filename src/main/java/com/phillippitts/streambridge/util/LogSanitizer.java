package com.phillippitts.streambridge.util;

/** Utility for privacy-safe logging of transcript previews and client-supplied strings. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 40;

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
     * Short single-line preview for debug logs. Control characters are replaced so that a
     * client cannot forge log lines.
     */
    public static String preview(String s) {
        String cut = truncate(s, DEFAULT_PREVIEW);
        StringBuilder sb = new StringBuilder(cut.length() + 3);
        for (int i = 0; i < cut.length(); i++) {
            char c = cut.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        if (s != null && s.length() > DEFAULT_PREVIEW) {
            sb.append("...");
        }
        return sb.toString();
    }
}
