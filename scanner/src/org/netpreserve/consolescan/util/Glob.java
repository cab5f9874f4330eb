package org.netpreserve.consolescan.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive wildcard pattern matched against a whole string. {@code *} matches any run of characters
 * (including none), {@code ?} matches exactly one and everything else is literal.
 */
public final class Glob {
    private final String pattern;
    private final Pattern regex;

    private Glob(String pattern, Pattern regex) {
        this.pattern = pattern;
        this.regex = regex;
    }

    public static Glob compile(String pattern) {
        if (pattern == null || pattern.isBlank()) throw new IllegalArgumentException("Empty pattern");
        var regex = new StringBuilder(pattern.length() + 8);
        var literal = new StringBuilder();
        for (char c : pattern.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return new Glob(pattern, Pattern.compile(regex.toString(), Pattern.DOTALL));
    }

    public boolean matches(String text) {
        return text != null && regex.matcher(text.toLowerCase(Locale.ROOT)).matches();
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
