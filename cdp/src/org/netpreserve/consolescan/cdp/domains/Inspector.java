package org.netpreserve.consolescan.cdp.domains;

import java.util.function.Consumer;

public interface Inspector {
    void enable();

    void onTargetCrashed(Consumer<TargetCrashed> handler);

    record TargetCrashed() {
    }
}
