package com.williamcallahan.specweave.domain.biblio;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * An entry of the bibliography: something defined by the document (or an imported one)
 * that cross-references, non-terminals and autolinks can point at.
 *
 * <p>Entries are immutable. The mutable parts of an entry's lifecycle (back-references,
 * finalized step paths) live in the bibliography that owns it.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClauseEntry.class, name = "clause"),
    @JsonSubTypes.Type(value = StepEntry.class, name = "step"),
    @JsonSubTypes.Type(value = TermEntry.class, name = "term"),
    @JsonSubTypes.Type(value = OperationEntry.class, name = "op"),
    @JsonSubTypes.Type(value = ProductionEntry.class, name = "production"),
    @JsonSubTypes.Type(value = FigureEntry.class, name = "figure"),
    @JsonSubTypes.Type(value = TableEntry.class, name = "table"),
    @JsonSubTypes.Type(value = ExampleEntry.class, name = "example"),
    @JsonSubTypes.Type(value = NoteEntry.class, name = "note")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface BiblioEntry
    permits ClauseEntry, StepEntry, TermEntry, OperationEntry, ProductionEntry,
        FigureEntry, TableEntry, ExampleEntry, NoteEntry {

    /**
     * Own anchor id, unique across the document; null for entries that only point at another anchor.
     *
     * @return id or null
     */
    String id();

    /**
     * Namespace the entry was defined in.
     *
     * @return namespace name
     */
    String namespace();

    /**
     * Entry kind tag.
     *
     * @return kind
     */
    @JsonIgnore
    EntryKind kind();

    /**
     * Anchor the entry links to: its own id, or the id of the element it was defined under.
     *
     * @return anchor id or null when the entry has none
     */
    @JsonIgnore
    default String anchorId() {
        return id();
    }

    /**
     * Textual keys the entry can be found by, besides its id.
     *
     * @return lookup keys; empty for id-only entries
     */
    @JsonIgnore
    default List<String> lookupKeys() {
        return List.of();
    }
}
