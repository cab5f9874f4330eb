package org.netpreserve.consolescan.cdp.domains;

public interface Emulation {
    void setUserAgentOverride(String userAgent);
}
