package com.williamcallahan.specweave.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag observed at the start of each major compilation phase.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Returns a signal that is never cancelled.
     *
     * @return fresh signal
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Requests cancellation; takes effect at the next phase boundary.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Aborts the compilation when cancellation has been requested.
     *
     * @param phase name of the phase about to start
     * @throws CompilationCancelledException if cancelled
     */
    public void throwIfCancellationRequested(String phase) {
        if (cancelled.get()) {
            throw new CompilationCancelledException(phase);
        }
    }
}
