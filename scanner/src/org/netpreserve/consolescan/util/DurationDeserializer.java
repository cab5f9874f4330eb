package org.netpreserve.consolescan.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 1500}), shorthand ({@code 30s}, {@code 1m30s}) or ISO-8601
 * ({@code PT30S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofMillis(parser.getLongValue());
        String text = parser.getText().trim();
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw InvalidFormatException.from(parser, "Invalid duration (expected e.g. 30s or 500ms)", text,
                    Duration.class);
        }
    }

    public static Duration parse(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.endsWith("MS") && !upper.startsWith("P")) {
            return Duration.ofMillis(Long.parseLong(upper.substring(0, upper.length() - 2).trim()));
        }
        if (upper.startsWith("P")) return Duration.parse(upper);
        return Duration.parse("PT" + upper);
    }
}
