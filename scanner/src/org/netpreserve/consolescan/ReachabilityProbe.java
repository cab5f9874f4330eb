package org.netpreserve.consolescan;

import org.netpreserve.consolescan.util.Url;

/**
 * Quick check of whether a page's server answers at all, run before retrying it.
 */
public interface ReachabilityProbe {
    ReachabilityProbe NONE = (url, token) -> true;

    boolean isReachable(Url url, CancellationToken token) throws InterruptedException;
}
