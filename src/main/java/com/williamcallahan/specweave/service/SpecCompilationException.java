package com.williamcallahan.specweave.service;

/**
 * Signals a fatal failure that aborts the whole compilation. No output is produced.
 */
public class SpecCompilationException extends IllegalStateException {

    /**
     * Creates a compilation exception with a failure summary.
     *
     * @param message failure summary
     */
    public SpecCompilationException(String message) {
        super(message);
    }

    /**
     * Creates a compilation exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public SpecCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
