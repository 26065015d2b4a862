package com.williamcallahan.specweave.service;

/**
 * Signals an authoring or wiring error in the document structure that cannot be recovered,
 * such as legacy-id markers on an element that cannot hold children.
 */
public class SpecStructureException extends SpecCompilationException {

    /**
     * Creates a structure exception.
     *
     * @param message description of the malformed structure
     */
    public SpecStructureException(String message) {
        super(message);
    }
}
