package com.williamcallahan.specweave.service;

/**
 * Signals that an external biblio table could not be read or parsed.
 */
public class BiblioLoadException extends SpecCompilationException {

    /**
     * Creates a biblio load failure with a message and the original cause.
     *
     * @param message explanation of the failure
     * @param cause underlying I/O or parse failure
     */
    public BiblioLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
