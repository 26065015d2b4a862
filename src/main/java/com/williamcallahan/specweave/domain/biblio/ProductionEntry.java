package com.williamcallahan.specweave.domain.biblio;

import java.util.List;

/**
 * The primary definition of a grammar production.
 *
 * @param id production id, {@code prod-<name>}
 * @param namespace namespace of the definition
 * @param name non-terminal name
 */
public record ProductionEntry(String id, String namespace, String name) implements BiblioEntry {

    public ProductionEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Production name cannot be null or empty");
        }
    }

    @Override
    public EntryKind kind() {
        return EntryKind.PRODUCTION;
    }

    @Override
    public List<String> lookupKeys() {
        return List.of(name);
    }
}
