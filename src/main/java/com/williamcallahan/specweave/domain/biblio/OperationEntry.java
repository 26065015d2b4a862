package com.williamcallahan.specweave.domain.biblio;

import java.util.List;

/**
 * An abstract operation, named by an {@code aoid} on a clause or equation.
 *
 * @param id own id, usually null
 * @param refId id of the defining clause or equation
 * @param namespace namespace the operation is visible in
 * @param aoid operation name
 */
public record OperationEntry(String id, String refId, String namespace, String aoid) implements BiblioEntry {

    public OperationEntry {
        if (aoid == null || aoid.isBlank()) {
            throw new IllegalArgumentException("Operation aoid cannot be null or empty");
        }
    }

    @Override
    public EntryKind kind() {
        return EntryKind.OPERATION;
    }

    @Override
    public String anchorId() {
        return id != null ? id : refId;
    }

    @Override
    public List<String> lookupKeys() {
        return List.of(aoid);
    }
}
