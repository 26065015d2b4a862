package com.williamcallahan.specweave.service.diagnostics;

import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;

/**
 * Receives recoverable problems. The compiler never throws for these.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * Accepts one diagnostic.
     *
     * @param diagnostic the reported problem
     */
    void report(Diagnostic diagnostic);
}
