package com.williamcallahan.specweave.service.linking;

/**
 * Kinds of deferred references, in the order they are resolved.
 */
public enum ReferenceKind {
    /** An {@code emu-xref} pointing at an id or an operation name. */
    XREF,
    /** An {@code emu-nt} naming a grammar production. */
    NONTERMINAL,
    /** An {@code emu-prodref} that copies a production's markup. */
    PRODUCTION_REFERENCE
}
