package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.consolescan.util.DurationDeserializer;

import java.time.Duration;

/**
 * @param maxAttempts  attempts per page including the first
 * @param backoff      delay before the first retry, doubled for each later one
 * @param probe        check whether the host answers before retrying (logged only)
 * @param probeTimeout limit on the reachability check
 */
public record RetryConfig(
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class) Duration backoff,
        boolean probe,
        @JsonDeserialize(using = DurationDeserializer.class) Duration probeTimeout
) {
    public RetryConfig {
        if (maxAttempts < 1) throw new IllegalArgumentException("retry.maxAttempts must be at least 1");
    }
}
