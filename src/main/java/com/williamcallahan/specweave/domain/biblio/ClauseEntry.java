package com.williamcallahan.specweave.domain.biblio;

/**
 * A numbered (or unnumbered introductory) section of the document.
 *
 * @param id clause id
 * @param namespace namespace the clause opened or inherited
 * @param aoid operation name the clause defines, or null
 * @param title header text without the section number, or null when the clause has no header
 * @param number dotted section number; empty for unnumbered clauses
 */
public record ClauseEntry(String id, String namespace, String aoid, String title, String number)
    implements BiblioEntry {

    @Override
    public EntryKind kind() {
        return EntryKind.CLAUSE;
    }
}
