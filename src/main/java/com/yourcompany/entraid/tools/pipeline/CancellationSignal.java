package com.yourcompany.entraid.tools.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation flag shared by the stages of a run. Once raised, no new
 * page request and no new enrichment task is started.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param stage Name of the stage being entered, used in the exception message.
     * @throws CancellationException if the signal has been raised.
     */
    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new CancellationException("Run cancelled before " + stage);
        }
    }
}
