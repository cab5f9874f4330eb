package org.netpreserve.consolescan.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogUtilsTest {
    @Test
    void ellipses() {
        assertEquals("{url: \"short\"}", LogUtils.ellipses("{url: \"short\"}"));
        assertEquals("{data: \"abcde...vwxyz\", n: 1}",
                LogUtils.ellipses("{data: \"abcdefghijklmnopqrstuvwxyz\", n: 1}", 10));
        assertEquals("{a: \"esc\\\"aped\"}", LogUtils.ellipses("{a: \"esc\\\"aped\"}"));
        assertEquals("unterminated \"quote", LogUtils.ellipses("unterminated \"quote"));
    }

    @Test
    void abbreviate() {
        assertEquals("hello", LogUtils.abbreviate("hello", 10));
        assertEquals("hello w...", LogUtils.abbreviate("hello world!", 10));
        assertNull(LogUtils.abbreviate(null, 10));
    }
}
