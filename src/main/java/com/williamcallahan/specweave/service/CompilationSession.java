package com.williamcallahan.specweave.service;

import com.williamcallahan.specweave.domain.OutlineEntry;
import com.williamcallahan.specweave.domain.biblio.BiblioEntry;
import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;
import com.williamcallahan.specweave.domain.diagnostics.DiagnosticKind;
import com.williamcallahan.specweave.domain.diagnostics.SourceLocation;
import com.williamcallahan.specweave.service.biblio.Bibliography;
import com.williamcallahan.specweave.service.biblio.DuplicateIdException;
import com.williamcallahan.specweave.service.diagnostics.DiagnosticSink;
import com.williamcallahan.specweave.service.diagnostics.SourceLocator;
import com.williamcallahan.specweave.service.linking.DeferredReference;
import com.williamcallahan.specweave.service.linking.ReplacementDeclaration;
import com.williamcallahan.specweave.service.traversal.TextSpanEntry;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * State of one compilation: the tree, the bibliography, and everything the walk records
 * for the passes that run after it.
 *
 * <p>The walk writes; the post-walk passes read and consume. A session is used for exactly
 * one compilation and is not thread-safe.</p>
 */
public class CompilationSession {

    private static final Logger log = LoggerFactory.getLogger(CompilationSession.class);
    private static final String REFERENCE_ID_PREFIX = "_ref_";

    private final Document document;
    private final Bibliography bibliography;
    private final DiagnosticSink sink;
    private final SourceLocator locator;
    private final CancellationSignal cancellation;

    private final Set<String> nodeIds = new HashSet<>();
    private final Set<Element> duplicateIdElements = Collections.newSetFromMap(new IdentityHashMap<>());
    private int referenceCounter;

    private final List<DeferredReference> deferredReferences = new ArrayList<>();
    private final List<ReplacementDeclaration> replacementDeclarations = new ArrayList<>();
    private final Set<String> stepsAwaitingReplacement = new HashSet<>();
    private final Map<String, List<TextSpanEntry>> textSpansByNamespace = new LinkedHashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> primaryProductions = new HashSet<>();
    private final List<OutlineEntry> outline = new ArrayList<>();

    /**
     * Creates a session.
     *
     * @param document parsed document
     * @param bibliography empty bibliography for the document namespace
     * @param sink diagnostic receiver
     * @param locator maps nodes back to source positions
     * @param cancellation cooperative cancellation signal
     */
    public CompilationSession(Document document, Bibliography bibliography, DiagnosticSink sink,
                              SourceLocator locator, CancellationSignal cancellation) {
        this.document = Objects.requireNonNull(document, "document");
        this.bibliography = Objects.requireNonNull(bibliography, "bibliography");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    }

    public Document document() {
        return document;
    }

    public Bibliography bibliography() {
        return bibliography;
    }

    public SourceLocator locator() {
        return locator;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    /**
     * Claims the id of an element. A second element with the same id is reported and
     * never becomes a reference target.
     *
     * @param element element carrying an {@code id} attribute
     * @return true when the id was free
     */
    public boolean registerNodeId(Element element) {
        String id = element.id();
        if (id.isEmpty()) {
            return true;
        }
        if (nodeIds.add(id)) {
            return true;
        }
        duplicateIdElements.add(element);
        reportNode(element, "duplicate-id", "duplicate id \"" + id + "\"");
        return false;
    }

    /**
     * Gives an element an id derived from a preferred one and claims it. When the preferred id
     * is already claimed or is carried by another element of the document, a numeric suffix
     * is appended until the id is free.
     *
     * @param element element to assign an id to
     * @param preferredId requested id
     * @return the id that was assigned
     */
    public String assignUniqueNodeId(Element element, String preferredId) {
        String id = preferredId;
        int suffix = 2;
        while (isIdTaken(id, element)) {
            id = preferredId + "-" + suffix++;
        }
        element.attr("id", id);
        nodeIds.add(id);
        return id;
    }

    private boolean isIdTaken(String id, Element element) {
        if (nodeIds.contains(id)) {
            return true;
        }
        Element holder = document.getElementById(id);
        return holder != null && holder != element;
    }

    public boolean isDuplicateId(Element element) {
        return duplicateIdElements.contains(element);
    }

    /**
     * Returns the next unused reference id.
     *
     * @return id of the form {@code _ref_N}
     */
    public String nextReferenceId() {
        String id;
        do {
            id = REFERENCE_ID_PREFIX + referenceCounter++;
        } while (!nodeIds.add(id));
        return id;
    }

    /**
     * Adds an entry defined by an element. Elements carrying a duplicate id define nothing.
     *
     * @param definingElement element the entry came from
     * @param entry entry to add
     * @return true when the entry was added
     */
    public boolean define(Element definingElement, BiblioEntry entry) {
        if (definingElement != null && isDuplicateId(definingElement)) {
            log.debug("Skipping {} entry of duplicate id {}", entry.kind().label(), entry.id());
            return false;
        }
        try {
            bibliography.define(entry);
            return true;
        } catch (DuplicateIdException e) {
            if (definingElement == null) {
                reportGlobal("duplicate-id", e.getMessage());
            } else {
                reportNode(definingElement, "duplicate-id", e.getMessage());
            }
            return false;
        }
    }

    public void addDeferredReference(DeferredReference reference) {
        deferredReferences.add(reference);
    }

    public List<DeferredReference> deferredReferences() {
        return List.copyOf(deferredReferences);
    }

    /**
     * Records a replacement algorithm. Its labeled steps keep provisional paths until the
     * replacement is resolved.
     *
     * @param declaration replacement declaration
     */
    public void addReplacementDeclaration(ReplacementDeclaration declaration) {
        replacementDeclarations.add(declaration);
        stepsAwaitingReplacement.addAll(declaration.containedStepIds());
    }

    public List<ReplacementDeclaration> replacementDeclarations() {
        return List.copyOf(replacementDeclarations);
    }

    public boolean isAwaitingReplacement(String stepId) {
        return stepsAwaitingReplacement.contains(stepId);
    }

    public void markReplacementResolved(String stepId) {
        stepsAwaitingReplacement.remove(stepId);
    }

    public void addTextSpan(TextSpanEntry span) {
        textSpansByNamespace.computeIfAbsent(span.namespace(), ns -> new ArrayList<>()).add(span);
    }

    /**
     * Returns recorded text spans grouped by namespace, in the order namespaces were first seen.
     *
     * @return namespace to spans
     */
    public Map<String, List<TextSpanEntry>> textSpansByNamespace() {
        Map<String, List<TextSpanEntry>> copy = new LinkedHashMap<>();
        textSpansByNamespace.forEach((namespace, spans) -> copy.put(namespace, List.copyOf(spans)));
        return copy;
    }

    /**
     * Increments a document-wide counter.
     *
     * @param name counter name
     * @return new value, starting at 1
     */
    public int nextCount(String name) {
        return counters.merge(name, 1, Integer::sum);
    }

    /**
     * Claims the primary definition of a production name within a namespace.
     *
     * @param namespace namespace of the production
     * @param name production name
     * @return true for the first claim
     */
    public boolean claimPrimaryProduction(String namespace, String name) {
        return primaryProductions.add(namespace + '\u0000' + name);
    }

    public void addTopLevelClause(OutlineEntry entry) {
        outline.add(entry);
    }

    public List<OutlineEntry> outline() {
        return List.copyOf(outline);
    }

    public void reportGlobal(String ruleId, String message) {
        sink.report(Diagnostic.global(ruleId, message));
    }

    /**
     * Reports a problem anchored at a node.
     *
     * @param node offending node
     * @param ruleId rule identifier
     * @param message description
     */
    public void reportNode(Node node, String ruleId, String message) {
        SourceLocation location = locator.locationOf(node).orElse(null);
        sink.report(new Diagnostic(DiagnosticKind.NODE, ruleId, message, location, nodeType(node)));
    }

    /**
     * Reports a problem with one attribute of an element.
     *
     * @param element offending element
     * @param attribute attribute name
     * @param ruleId rule identifier
     * @param message description
     */
    public void reportAttribute(Element element, String attribute, String ruleId, String message) {
        SourceLocation location = locator.locationOf(element).orElse(null);
        sink.report(new Diagnostic(DiagnosticKind.ATTRIBUTE, ruleId,
            message + " (attribute " + attribute + ")", location, nodeType(element)));
    }

    /**
     * Reports a problem at a character offset inside a text node.
     *
     * @param node text node
     * @param offset character offset into the node's text
     * @param ruleId rule identifier
     * @param message description
     */
    public void reportTextOffset(TextNode node, int offset, String ruleId, String message) {
        SourceLocation location = locator.locationOf(node)
            .map(start -> shift(start, node.getWholeText(), offset))
            .orElse(null);
        sink.report(new Diagnostic(DiagnosticKind.TEXT_OFFSET, ruleId, message, location, "text"));
    }

    private static SourceLocation shift(SourceLocation start, String text, int offset) {
        int line = 0;
        int column = 0;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        SourceLocation shifted = start.shiftedBy(line + 1, column + 1);
        return new SourceLocation(shifted.file(), shifted.line(), shifted.column(),
            start.offset() < 0 ? -1 : start.offset() + end);
    }

    private static String nodeType(Node node) {
        return node instanceof Element element ? element.normalName() : "text";
    }
}
