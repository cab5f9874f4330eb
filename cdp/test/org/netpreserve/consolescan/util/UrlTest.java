package org.netpreserve.consolescan.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {
    @Test
    void parts() {
        var url = new Url("HTTPS://Example.ORG:8443/a/b?q=1#frag");
        assertEquals("https", url.scheme());
        assertEquals("example.org", url.host());
        assertEquals(new Url("https://example.org:8443"), url.origin());
        assertEquals(new Url("HTTPS://Example.ORG:8443/a/b?q=1"), url.withoutFragment());
        assertTrue(url.isHttp());
    }

    @Test
    void nonHttpUrls() {
        assertFalse(new Url("ftp://example.org/").isHttp());
        assertFalse(new Url("/relative/path").isHttp());
        assertFalse(new Url("not a url").isHttp());
        assertNull(new Url("not a url").host());
    }

    @Test
    void resolve() {
        var base = new Url("https://example.org/dir/page.html");
        assertEquals(new Url("https://example.org/sitemap.xml"), base.resolve("/sitemap.xml"));
        assertEquals(new Url("https://example.org/dir/other.html"), base.resolve(" other.html "));
        assertEquals(new Url("https://cdn.example.org/x"), base.resolve("https://cdn.example.org/x"));
    }
}
