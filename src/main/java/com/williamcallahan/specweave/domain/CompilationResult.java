package com.williamcallahan.specweave.domain;

import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;

import java.util.List;

/**
 * Everything a successful compilation produces.
 *
 * @param html rendered document
 * @param diagnostics recoverable problems, in the order they were found
 * @param outline top-level clauses with their nested clauses
 * @param biblioJson export of the document's entries, {@code {}} when no location is configured
 */
public record CompilationResult(String html, List<Diagnostic> diagnostics, List<OutlineEntry> outline, String biblioJson) {

    public CompilationResult {
        if (html == null) {
            throw new IllegalArgumentException("Rendered html cannot be null");
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        outline = outline == null ? List.of() : List.copyOf(outline);
        biblioJson = biblioJson == null ? "{}" : biblioJson;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
