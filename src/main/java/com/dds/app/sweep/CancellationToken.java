package com.dds.app.sweep;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. A child token reports cancelled when it or any ancestor is.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationToken parent;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /** Returns true if this call was the one that cancelled the token. */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
