package com.phillippitts.modelorchestrator.util;

/** Privacy-safe previews of task input for logs. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncates to at most {@code max} characters, marking cut text with "..."; returns "" for
     * null or a non-positive limit. Line breaks are flattened so one log event stays on one line.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        if (max <= ELLIPSIS.length()) {
            return flat.substring(0, max);
        }
        return flat.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
