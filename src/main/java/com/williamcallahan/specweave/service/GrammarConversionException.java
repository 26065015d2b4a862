package com.williamcallahan.specweave.service;

/**
 * Signals that embedded grammar notation could not be converted to markup.
 */
public class GrammarConversionException extends SpecCompilationException {

    /**
     * Creates a grammar conversion failure.
     *
     * @param message explanation of the failure
     * @param cause the engine's failure
     */
    public GrammarConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
