package com.williamcallahan.specweave.domain.biblio;

import java.util.ArrayList;
import java.util.List;

/**
 * A defined term, introduced by a {@code dfn}.
 *
 * @param id the dfn's own id, or null
 * @param refId anchor the term links to when it has no id of its own
 * @param namespace namespace of the definition
 * @param term normalized term text
 * @param variants alternative spellings that link to the same definition
 */
public record TermEntry(String id, String refId, String namespace, String term, List<String> variants)
    implements BiblioEntry {

    public TermEntry {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Term cannot be null or empty");
        }
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    @Override
    public EntryKind kind() {
        return EntryKind.TERM;
    }

    @Override
    public String anchorId() {
        return id != null ? id : refId;
    }

    @Override
    public List<String> lookupKeys() {
        List<String> keys = new ArrayList<>(variants.size() + 1);
        keys.add(term);
        keys.addAll(variants);
        return keys;
    }
}
