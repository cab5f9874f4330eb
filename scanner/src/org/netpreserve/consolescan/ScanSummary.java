package org.netpreserve.consolescan;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Totals across a whole scan.
 *
 * @param totalUrls  URLs queued after filtering and removing duplicates
 * @param scanned    pages that loaded (any status but failed)
 * @param failed     pages that could not be loaded
 * @param skipped    URLs never started because the scan was cancelled or stopped
 * @param byStatus   pages per status
 * @param byKind     distinct non-whitelisted diagnostics per kind, summed over pages
 * @param topErrors  the most widespread non-whitelisted messages
 * @param fault      what stopped the scan early, if anything
 */
public record ScanSummary(
        Instant startedAt,
        Duration duration,
        int totalUrls,
        int scanned,
        int failed,
        int skipped,
        Map<PageStatus, Integer> byStatus,
        Map<ErrorKind, Integer> byKind,
        List<TopError> topErrors,
        boolean cancelled,
        @Nullable ScanFault fault,
        int browserRestarts
) {
    /**
     * A message and how widely it was seen.
     *
     * @param pages       number of pages it appeared on
     * @param occurrences total times it was seen across those pages
     */
    public record TopError(ErrorKind kind, String message, int pages, int occurrences) {
    }

    public static ScanSummary of(Collection<ScanResult> results, int totalUrls, Instant startedAt, Duration duration,
                                 int topN, boolean cancelled, @Nullable ScanFault fault, int browserRestarts) {
        var byStatus = new EnumMap<PageStatus, Integer>(PageStatus.class);
        for (var status : PageStatus.values()) byStatus.put(status, 0);
        var byKind = new EnumMap<ErrorKind, Integer>(ErrorKind.class);
        for (var kind : ErrorKind.values()) byKind.put(kind, 0);

        var pagesByKey = new HashMap<PageError.Key, Set<String>>();
        var occurrencesByKey = new HashMap<PageError.Key, Integer>();
        for (ScanResult result : results) {
            byStatus.merge(result.status(), 1, Integer::sum);
            for (PageError error : result.errors()) {
                if (error.whitelisted()) continue;
                byKind.merge(error.kind(), 1, Integer::sum);
                pagesByKey.computeIfAbsent(error.key(), key -> new HashSet<>()).add(result.url().toString());
                occurrencesByKey.merge(error.key(), error.occurrences(), Integer::sum);
            }
        }

        var topErrors = new ArrayList<TopError>();
        pagesByKey.forEach((key, pages) -> topErrors.add(new TopError(key.kind(), key.message(), pages.size(),
                occurrencesByKey.get(key))));
        topErrors.sort(Comparator.comparingInt(TopError::pages).reversed()
                .thenComparing(Comparator.comparingInt(TopError::occurrences).reversed())
                .thenComparing(TopError::message));

        int failed = byStatus.get(PageStatus.FAILED);
        return new ScanSummary(startedAt, duration, totalUrls, results.size() - failed, failed,
                totalUrls - results.size(), Collections.unmodifiableMap(byStatus), Collections.unmodifiableMap(byKind),
                List.copyOf(topErrors.subList(0, Math.min(topN, topErrors.size()))), cancelled, fault,
                browserRestarts);
    }

    public int count(PageStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public int distinctCount(ErrorKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
