package org.netpreserve.consolescan.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL as given to us, with its parsed form cached. Equality is on the original string so the same page
 * written two different ways counts as two pages.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public static Url orNull(String url) {
        if (url == null) return null;
        return new Url(url);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    private URI parsedOrNull() {
        try {
            return toURI();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Lowercase host name, or null if the URL can't be parsed or has no host.
     */
    public String host() {
        URI parsed = parsedOrNull();
        if (parsed == null || parsed.getHost() == null) return null;
        return parsed.getHost().toLowerCase(Locale.ROOT);
    }

    public String scheme() {
        int colon = url.indexOf(':');
        if (colon <= 0) return null;
        return url.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    /**
     * True for absolute http and https URLs that have a host.
     */
    public boolean isHttp() {
        String scheme = scheme();
        return ("http".equals(scheme) || "https".equals(scheme)) && host() != null;
    }

    /**
     * Scheme, host and port, e.g. {@code https://example.org:8080}.
     */
    public Url origin() {
        URI parsed = parsedOrNull();
        if (parsed == null || parsed.getHost() == null) throw new IllegalStateException("No origin: " + url);
        String port = parsed.getPort() == -1 ? "" : ":" + parsed.getPort();
        return new Url(parsed.getScheme().toLowerCase(Locale.ROOT) + "://" + host() + port);
    }

    public Url resolve(String reference) {
        try {
            return new Url(toURI().resolve(reference.trim()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return new Url(reference.trim());
        }
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) return this;
        return new Url(url.substring(0, i));
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return url.equals(((Url) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
