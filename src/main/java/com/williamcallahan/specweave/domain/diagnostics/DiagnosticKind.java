package com.williamcallahan.specweave.domain.diagnostics;

/**
 * Classifies what a diagnostic is anchored to.
 */
public enum DiagnosticKind {
    /**
     * Concerns the whole document; carries no location.
     */
    GLOBAL,

    /**
     * Anchored to an element or text node.
     */
    NODE,

    /**
     * Anchored to a named attribute of an element.
     */
    ATTRIBUTE,

    /**
     * Anchored to a line and column relative to a node's content.
     */
    TEXT_OFFSET,

    /**
     * Anchored to an explicit file position outside the tree.
     */
    RAW
}
