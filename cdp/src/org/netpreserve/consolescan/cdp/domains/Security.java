package org.netpreserve.consolescan.cdp.domains;

public interface Security {
    void setIgnoreCertificateErrors(boolean ignore);
}
