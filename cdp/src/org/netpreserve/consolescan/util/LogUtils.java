package org.netpreserve.consolescan.util;

public class LogUtils {
    private static final int DEFAULT_MAX_QUOTED = 40;

    /**
     * Shortens long quoted strings in a JSON-ish message so trace logs stay readable, keeping the start and end
     * of each.
     */
    public static String ellipses(String string) {
        return ellipses(string, DEFAULT_MAX_QUOTED);
    }

    public static String ellipses(String string, int maxQuoted) {
        if (string == null) return null;
        var output = new StringBuilder(Math.min(string.length(), 1024));
        int i = 0;
        while (i < string.length()) {
            char c = string.charAt(i);
            int close = c == '"' ? closingQuote(string, i + 1) : -1;
            if (close < 0) {
                output.append(c);
                i++;
                continue;
            }
            int length = close - i - 1;
            if (length <= maxQuoted) {
                output.append(string, i, close + 1);
            } else {
                int keep = maxQuoted / 2;
                output.append('"').append(string, i + 1, i + 1 + keep).append("...")
                        .append(string, close - keep, close).append('"');
            }
            i = close + 1;
        }
        return output.toString();
    }

    private static int closingQuote(String string, int from) {
        for (int i = from; i < string.length(); i++) {
            char c = string.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Truncates a single-line message for display.
     */
    public static String abbreviate(String string, int maxLength) {
        if (string == null || string.length() <= maxLength) return string;
        return string.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
