package org.netpreserve.consolescan;

import org.netpreserve.consolescan.config.ScanConfig;
import org.netpreserve.consolescan.util.Url;

/**
 * A page waiting to be scanned.
 *
 * @param index position of the URL in the input list, used to report results in input order
 */
public record ScanTask(Url url, ScanConfig config, int index) {
}
