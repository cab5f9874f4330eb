package org.netpreserve.consolescan.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

import static ch.qos.logback.core.pattern.color.ANSIConstants.*;

/**
 * Colours the level in console output. Registered as {@code %highlight} in logback.xml.
 */
public class LogHighlighter extends ForegroundCompositeConverterBase<ILoggingEvent> {
    @Override
    protected String getForegroundColorCode(ILoggingEvent event) {
        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) return BOLD + RED_FG;
        if (level >= Level.WARN_INT) return YELLOW_FG;
        if (level >= Level.INFO_INT) return CYAN_FG;
        return DEFAULT_FG;
    }
}
