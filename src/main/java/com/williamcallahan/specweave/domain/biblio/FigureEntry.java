package com.williamcallahan.specweave.domain.biblio;

/**
 * A numbered figure.
 *
 * @param id figure id
 * @param namespace namespace of the enclosing clause
 * @param number document-wide figure number
 * @param caption caption text, or null
 */
public record FigureEntry(String id, String namespace, int number, String caption) implements BiblioEntry {

    @Override
    public EntryKind kind() {
        return EntryKind.FIGURE;
    }
}
