package com.williamcallahan.specweave.domain;

import java.util.List;

/**
 * One clause of the document outline.
 *
 * @param id clause id, or null
 * @param number dotted section number, empty when unnumbered
 * @param title header text without the number, or null when the clause has no header
 * @param children nested clauses in document order
 */
public record OutlineEntry(String id, String number, String title, List<OutlineEntry> children) {

    public OutlineEntry {
        number = number == null ? "" : number;
        children = children == null ? List.of() : List.copyOf(children);
    }
}
