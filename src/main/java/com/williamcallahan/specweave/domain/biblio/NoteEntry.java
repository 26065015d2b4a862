package com.williamcallahan.specweave.domain.biblio;

/**
 * A note, numbered within its clause.
 *
 * @param id note id
 * @param namespace namespace of the enclosing clause
 * @param number 1-based position among the clause's notes
 * @param clauseId id of the enclosing clause, or null
 */
public record NoteEntry(String id, String namespace, int number, String clauseId) implements BiblioEntry {

    @Override
    public EntryKind kind() {
        return EntryKind.NOTE;
    }
}
