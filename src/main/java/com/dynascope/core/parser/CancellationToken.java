package com.dynascope.core.parser;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by every task of one run.
 * Readers poll it between records.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new AnalysisCancelledException("Analysis cancelled");
        }
    }
}
