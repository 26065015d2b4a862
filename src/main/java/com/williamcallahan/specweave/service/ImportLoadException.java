package com.williamcallahan.specweave.service;

/**
 * Signals that an imported document fragment could not be loaded.
 */
public class ImportLoadException extends SpecCompilationException {

    /**
     * Creates an import failure with a message.
     *
     * @param message explanation of the import failure
     */
    public ImportLoadException(String message) {
        super(message);
    }

    /**
     * Creates an import failure with a message and the original cause.
     *
     * @param message explanation of the import failure
     * @param cause underlying I/O failure
     */
    public ImportLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
