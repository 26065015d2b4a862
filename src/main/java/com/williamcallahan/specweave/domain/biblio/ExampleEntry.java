package com.williamcallahan.specweave.domain.biblio;

/**
 * A example, numbered within its clause.
 *
 * @param id example id
 * @param namespace namespace of the enclosing clause
 * @param number 1-based position among the clause's examples
 * @param clauseId id of the enclosing clause, or null
 */
public record ExampleEntry(String id, String namespace, int number, String clauseId) implements BiblioEntry {

    @Override
    public EntryKind kind() {
        return EntryKind.EXAMPLE;
    }
}
