package com.williamcallahan.specweave.service;

/**
 * Thrown at a phase boundary once cancellation has been requested.
 */
public class CompilationCancelledException extends SpecCompilationException {

    /**
     * Creates a cancellation outcome.
     *
     * @param phase the phase that observed the cancellation request
     */
    public CompilationCancelledException(String phase) {
        super("Compilation cancelled before " + phase);
    }
}
