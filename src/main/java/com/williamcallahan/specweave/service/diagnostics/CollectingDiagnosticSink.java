package com.williamcallahan.specweave.service.diagnostics;

import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every diagnostic of a compilation, logs it, and forwards it to an optional listener.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(CollectingDiagnosticSink.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink listener;

    public CollectingDiagnosticSink() {
        this(null);
    }

    /**
     * Creates a sink that also forwards to a listener.
     *
     * @param listener receiver notified as each diagnostic arrives, or null
     */
    public CollectingDiagnosticSink(DiagnosticSink listener) {
        this.listener = listener;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        log.warn("{}", diagnostic.describe());
        if (listener != null) {
            listener.report(diagnostic);
        }
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
