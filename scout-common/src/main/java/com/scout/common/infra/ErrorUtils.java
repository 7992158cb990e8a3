package com.scout.common.infra;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Truncate text for log lines and previews.
     */
    public static String preview(String text, int max) {
        if (text == null)
            return "";
        return text.length() <= max ? text : text.substring(0, max);
    }
}
