package com.williamcallahan.specweave.domain.biblio;

/**
 * Kinds of definable, referenceable entries.
 */
public enum EntryKind {
    CLAUSE,
    STEP,
    TERM,
    OPERATION,
    PRODUCTION,
    FIGURE,
    TABLE,
    EXAMPLE,
    NOTE;

    /**
     * Returns the lowercase label used in diagnostics.
     *
     * @return display label
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
