package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.consolescan.consent.ConsentMode;
import org.netpreserve.consolescan.util.DurationDeserializer;

import java.time.Duration;

/**
 * @param enabled whether to deal with cookie banners at all
 * @param mode    accept the banner, or only hide it
 * @param settle  how long to let the page react after consent is given
 */
public record ConsentConfig(
        boolean enabled,
        ConsentMode mode,
        @JsonDeserialize(using = DurationDeserializer.class) Duration settle
) {
}
