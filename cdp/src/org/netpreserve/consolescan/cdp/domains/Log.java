package org.netpreserve.consolescan.cdp.domains;

import java.util.function.Consumer;

/**
 * Browser-generated log entries: security warnings, interventions, deprecations and the like. Messages logged by
 * page scripts come through {@link Runtime#onConsoleAPICalled} instead.
 */
public interface Log {
    void enable();

    void onEntryAdded(Consumer<EntryAdded> handler);

    record EntryAdded(LogEntry entry) {
    }

    record LogEntry(String source, String level, String text, String category, String url, Integer lineNumber) {
    }
}
