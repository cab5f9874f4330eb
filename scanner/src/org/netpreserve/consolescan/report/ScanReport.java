package org.netpreserve.consolescan.report;

import org.netpreserve.consolescan.ScanResult;
import org.netpreserve.consolescan.ScanSummary;

import java.time.Instant;
import java.util.List;

/**
 * Everything that goes into a report file. May be taken mid-scan, in which case the summary covers only the
 * results so far.
 */
public record ScanReport(Instant generatedAt, ScanSummary summary, List<ScanResult> results) {
    public ScanReport {
        results = List.copyOf(results);
    }

    public static ScanReport of(ScanSummary summary, List<ScanResult> results) {
        return new ScanReport(Instant.now(), summary, results);
    }
}
