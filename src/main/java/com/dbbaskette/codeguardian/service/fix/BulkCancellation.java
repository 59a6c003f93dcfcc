package com.dbbaskette.codeguardian.service.fix;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancels a running bulk apply. Items already running finish; items not yet started are
 * reported as skipped.
 */
public final class BulkCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static BulkCancellation none() {
        return new BulkCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
