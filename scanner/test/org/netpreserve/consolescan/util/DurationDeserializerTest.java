package org.netpreserve.consolescan.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationDeserializerTest {
    @Test
    void parsesShorthandAndIsoDurations() {
        assertEquals(Duration.ofSeconds(30), DurationDeserializer.parse("30s"));
        assertEquals(Duration.ofMillis(250), DurationDeserializer.parse("250ms"));
        assertEquals(Duration.ofSeconds(90), DurationDeserializer.parse("1m30s"));
        assertEquals(Duration.ofMinutes(2), DurationDeserializer.parse("PT2M"));
        assertEquals(Duration.ZERO, DurationDeserializer.parse("0s"));
    }
}
