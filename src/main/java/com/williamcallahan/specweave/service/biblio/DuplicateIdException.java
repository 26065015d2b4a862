package com.williamcallahan.specweave.service.biblio;

import com.williamcallahan.specweave.domain.biblio.EntryKind;

/**
 * Signals that an entry id is already taken by another entry of the document.
 */
public class DuplicateIdException extends Exception {

    private final String duplicateId;

    /**
     * Creates a duplicate id failure.
     *
     * @param duplicateId the colliding id
     * @param existingKind kind of the entry that already owns the id
     */
    public DuplicateIdException(String duplicateId, EntryKind existingKind) {
        super("duplicate id \"" + duplicateId + "\" already defined by a " + existingKind.label());
        this.duplicateId = duplicateId;
    }

    public String duplicateId() {
        return duplicateId;
    }
}
