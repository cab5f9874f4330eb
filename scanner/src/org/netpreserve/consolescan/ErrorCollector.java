package org.netpreserve.consolescan;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.config.ConsoleLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics for one attempt at one page: filtered by console level, with repeats of the same message folded
 * together and whitelisted messages tagged.
 */
public class ErrorCollector {
    private final ConsoleLevel consoleLevel;
    private final Whitelist whitelist;
    private final Map<PageError.Key, PageError> errors = new LinkedHashMap<>();

    public ErrorCollector(ConsoleLevel consoleLevel, Whitelist whitelist) {
        this.consoleLevel = consoleLevel;
        this.whitelist = whitelist;
    }

    /**
     * @return the stored record if this is the first time the message was seen, otherwise null (dropped by the
     * console level or a duplicate)
     */
    public synchronized @Nullable PageError add(PageError error) {
        if (!consoleLevel.accepts(error.kind())) return null;
        PageError existing = errors.get(error.key());
        if (existing != null) {
            errors.put(error.key(), existing.withAnotherOccurrence());
            return null;
        }
        PageError stored = error.withWhitelisted(whitelist.matches(error.message()));
        errors.put(stored.key(), stored);
        return stored;
    }

    public synchronized List<PageError> errors() {
        return new ArrayList<>(errors.values());
    }

    public synchronized PageStatus status() {
        return PageStatus.of(errors.values());
    }

    public synchronized int size() {
        return errors.size();
    }
}
