package com.williamcallahan.specweave.domain.diagnostics;

/**
 * Represents a non-fatal problem found while compiling a document.
 * The compilation continues and the affected node keeps a safe fallback rendering.
 *
 * @param kind what the diagnostic is anchored to
 * @param ruleId stable identifier of the check that produced it
 * @param message human-readable description
 * @param location source position, or null when unknown or global
 * @param nodeType lowercase element name, {@code text} or {@code html}
 */
public record Diagnostic(
    DiagnosticKind kind,
    String ruleId,
    String message,
    SourceLocation location,
    String nodeType
) {

    public Diagnostic {
        if (kind == null) {
            throw new IllegalArgumentException("Diagnostic kind cannot be null");
        }
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("Diagnostic rule id cannot be null or empty");
        }
        if (message == null || message.trim().isEmpty()) {
            throw new IllegalArgumentException("Diagnostic message cannot be null or empty");
        }
        if (kind == DiagnosticKind.GLOBAL && location != null) {
            throw new IllegalArgumentException("Global diagnostics carry no location");
        }
    }

    /**
     * Creates a document-wide diagnostic.
     * @param ruleId rule identifier
     * @param message description
     * @return new Diagnostic instance
     */
    public static Diagnostic global(String ruleId, String message) {
        return new Diagnostic(DiagnosticKind.GLOBAL, ruleId, message, null, "html");
    }

    /**
     * Creates a diagnostic pointing at an explicit file position.
     * @param ruleId rule identifier
     * @param message description
     * @param file file name
     * @param line 1-based line
     * @param column 1-based column
     * @return new Diagnostic instance
     */
    public static Diagnostic raw(String ruleId, String message, String file, int line, int column) {
        return new Diagnostic(DiagnosticKind.RAW, ruleId, message, new SourceLocation(file, line, column, -1), "html");
    }

    /**
     * Formats the diagnostic the way command line output shows it.
     * @return single-line description
     */
    public String describe() {
        String where = location == null ? "" : location + ": ";
        return where + message + " (" + ruleId + ")";
    }
}
