package com.phillippitts.meetingscribe.util;

/**
 * Keeps transcript text and remote response bodies out of logs. Transcripts are logged by size,
 * error bodies as a short prefix.
 */
public final class LogSanitizer {

    private LogSanitizer() {
    }

    public static String truncate(String body, int maxChars) {
        if (body == null || maxChars <= 0) {
            return "";
        }
        return body.substring(0, Math.min(body.length(), maxChars));
    }

    public static String describeText(String text) {
        int length = text == null ? 0 : text.length();
        return "[" + length + " chars]";
    }
}
