package dev.univer.collector.service;

import java.util.concurrent.CancellationException;

/**
 * Cooperative stop flag. A child reports cancelled when it or any ancestor was cancelled,
 * cancelling a child leaves the parent untouched.
 */
public class CancellationSignal {

    private final CancellationSignal parent;
    private volatile boolean cancelled;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    public CancellationSignal child() {
        return new CancellationSignal(this);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException("Cancelled");
    }
}
