package com.williamcallahan.specweave.domain.biblio;

/**
 * A numbered table.
 *
 * @param id table id
 * @param namespace namespace of the enclosing clause
 * @param number document-wide table number
 * @param caption caption text, or null
 */
public record TableEntry(String id, String namespace, int number, String caption) implements BiblioEntry {

    @Override
    public EntryKind kind() {
        return EntryKind.TABLE;
    }
}
