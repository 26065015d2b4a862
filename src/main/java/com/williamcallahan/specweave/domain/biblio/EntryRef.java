package com.williamcallahan.specweave.domain.biblio;

import java.util.Objects;

/**
 * A bibliography entry together with the document it belongs to.
 *
 * @param entry the entry
 * @param location location key of the external table it came from, or null for the compiled document
 */
public record EntryRef(BiblioEntry entry, String location) {

    public EntryRef {
        Objects.requireNonNull(entry, "Entry is required");
    }

    /**
     * Creates a reference to an entry of the compiled document.
     * @param entry local entry
     * @return new EntryRef instance
     */
    public static EntryRef local(BiblioEntry entry) {
        return new EntryRef(entry, null);
    }

    /**
     * Returns whether the entry comes from an imported table.
     * @return true for external entries
     */
    public boolean isExternal() {
        return location != null;
    }

    /**
     * Builds the link target for this entry.
     * @return {@code #anchor} for local entries, {@code location#anchor} for external ones
     */
    public String href() {
        String anchor = entry.anchorId() == null ? "" : entry.anchorId();
        return (location == null ? "" : location) + "#" + anchor;
    }
}
