package com.williamcallahan.specweave.service.linking;

import com.williamcallahan.specweave.domain.biblio.BiblioEntry;
import com.williamcallahan.specweave.domain.biblio.ClauseEntry;
import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.domain.biblio.EntryRef;
import com.williamcallahan.specweave.domain.biblio.ExampleEntry;
import com.williamcallahan.specweave.domain.biblio.FigureEntry;
import com.williamcallahan.specweave.domain.biblio.NoteEntry;
import com.williamcallahan.specweave.domain.biblio.OperationEntry;
import com.williamcallahan.specweave.domain.biblio.ProductionEntry;
import com.williamcallahan.specweave.domain.biblio.StepEntry;
import com.williamcallahan.specweave.domain.biblio.TableEntry;
import com.williamcallahan.specweave.domain.biblio.TermEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.biblio.LookupResult;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the references recorded during the walk against the complete bibliography.
 *
 * <p>Cross-references resolve first, then non-terminals, then production references, so
 * copied productions carry resolved non-terminal links. A resolved reference is rewritten
 * into a link and recorded as a back-reference of its target; an unresolved one keeps its
 * authored form and is reported.</p>
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final Set<EntryKind> ANY_KIND = EnumSet.allOf(EntryKind.class);
    private static final Set<EntryKind> OPERATIONS = EnumSet.of(EntryKind.OPERATION);
    private static final Set<EntryKind> PRODUCTIONS = EnumSet.of(EntryKind.PRODUCTION);

    /**
     * Resolves every deferred reference of a session.
     *
     * @param session compilation state after the walk
     * @return number of references that resolved
     */
    public int resolve(CompilationSession session) {
        List<DeferredReference> references = new ArrayList<>(session.deferredReferences());
        references.sort(Comparator.comparing(DeferredReference::kind));
        int resolved = 0;
        for (DeferredReference reference : references) {
            if (resolveOne(reference, session)) {
                resolved++;
            }
        }
        log.info("Resolved {} of {} references", resolved, references.size());
        return resolved;
    }

    private boolean resolveOne(DeferredReference reference, CompilationSession session) {
        Set<EntryKind> expected = expectedKinds(reference);
        LookupResult result = session.bibliography().lookup(
            reference.namespace(), reference.explicitTargetId(), reference.key(), expected);

        if (result instanceof LookupResult.Found found) {
            return apply(reference, found.ref(), session);
        }
        if (result instanceof LookupResult.Ambiguous ambiguous) {
            String candidates = ambiguous.candidates().stream()
                .map(ref -> String.valueOf(ref.entry().anchorId()))
                .collect(Collectors.joining(", "));
            session.reportNode(reference.node(), "ambiguous-reference",
                "\"" + describeTarget(reference) + "\" matches more than one definition: " + candidates);
        } else if (result instanceof LookupResult.WrongKind wrongKind) {
            session.reportNode(reference.node(), wrongKindRule(reference),
                "expected " + describeExpected(reference) + " for \"" + describeTarget(reference)
                    + "\", found a " + wrongKind.ref().entry().kind().label());
        } else {
            session.reportNode(reference.node(), missingRule(reference), missingMessage(reference));
        }
        return false;
    }

    private boolean apply(DeferredReference reference, EntryRef target, CompilationSession session) {
        switch (reference.kind()) {
            case XREF -> linkCrossReference(reference.node(), target);
            case NONTERMINAL -> linkNonTerminal(reference.node(), target);
            case PRODUCTION_REFERENCE -> {
                if (!copyProduction(reference.node(), target, session)) {
                    return false;
                }
            }
        }
        if (!isDefiningNonTerminal(reference)) {
            recordBackReference(reference.node(), target, session);
        }
        return true;
    }

    private static void linkCrossReference(Element xref, EntryRef target) {
        Element existing = soleAnchor(xref);
        if (existing != null) {
            existing.attr("href", target.href());
            return;
        }
        Element anchor = new Element("a").attr("href", target.href());
        if (xref.text().isBlank() && xref.children().isEmpty()) {
            xref.empty();
            anchor.text(label(target.entry(), xref));
        } else {
            for (Node child : new ArrayList<>(xref.childNodes())) {
                anchor.appendChild(child);
            }
        }
        xref.appendChild(anchor);
    }

    private static void linkNonTerminal(Element nonTerminal, EntryRef target) {
        String name = nonTerminal.ownText().trim();
        for (Node child : new ArrayList<>(nonTerminal.childNodes())) {
            if (child instanceof TextNode) {
                child.remove();
            }
        }
        nonTerminal.prependChild(new Element("a").attr("href", target.href()).text(name));
    }

    private static boolean copyProduction(Element prodRef, EntryRef target, CompilationSession session) {
        if (target.isExternal()) {
            session.reportNode(prodRef, "invalid-prodref",
                "cannot copy production " + prodRef.attr("name") + " from " + target.location());
            return false;
        }
        Element production = session.document().getElementById(target.entry().anchorId());
        if (production == null) {
            session.reportNode(prodRef, "invalid-prodref",
                "production " + prodRef.attr("name") + " has no markup to copy");
            return false;
        }
        Element copy = production.clone();
        copy.removeAttr("id");
        for (Element withId : copy.select("[id]")) {
            withId.removeAttr("id");
        }
        prodRef.empty();
        prodRef.appendChild(copy);
        return true;
    }

    private static void recordBackReference(Element node, EntryRef target, CompilationSession session) {
        if (target.isExternal()) {
            return;
        }
        String anchorId = target.entry().anchorId();
        if (anchorId == null) {
            return;
        }
        if (node.id().isEmpty()) {
            node.attr("id", session.nextReferenceId());
        }
        session.bibliography().recordReference(anchorId, node.id());
    }

    /**
     * Label of a link with no authored content.
     *
     * @param entry link target
     * @param xref referring element
     * @return link text
     */
    static String label(BiblioEntry entry, Element xref) {
        if (entry instanceof ClauseEntry clause) {
            boolean useTitle = xref.hasAttr("title") || clause.number() == null || clause.number().isEmpty();
            if (useTitle && clause.title() != null) {
                return clause.title();
            }
            return clause.number() == null || clause.number().isEmpty() ? clause.id() : clause.number();
        }
        if (entry instanceof ProductionEntry production) {
            return production.name();
        }
        if (entry instanceof FigureEntry figure) {
            return "Figure " + figure.number();
        }
        if (entry instanceof TableEntry table) {
            return "Table " + table.number();
        }
        if (entry instanceof ExampleEntry example) {
            return "Example " + example.number();
        }
        if (entry instanceof NoteEntry note) {
            return "Note " + note.number();
        }
        if (entry instanceof StepEntry step) {
            return "step " + StepNumberFormatter.format(step.stepNumbers());
        }
        if (entry instanceof TermEntry term) {
            return term.term();
        }
        if (entry instanceof OperationEntry operation) {
            return operation.aoid();
        }
        return String.valueOf(entry.id());
    }

    private static Element soleAnchor(Element xref) {
        if (xref.childrenSize() != 1 || !"a".equals(xref.child(0).normalName())) {
            return null;
        }
        return xref.ownText().isBlank() ? xref.child(0) : null;
    }

    private static boolean isDefiningNonTerminal(DeferredReference reference) {
        if (reference.kind() != ReferenceKind.NONTERMINAL) {
            return false;
        }
        Element parent = reference.node().parent();
        return parent != null && "emu-production".equals(parent.normalName())
            && parent.selectFirst("> emu-nt") == reference.node();
    }

    private static Set<EntryKind> expectedKinds(DeferredReference reference) {
        if (reference.kind() == ReferenceKind.XREF) {
            return reference.hasExplicitTarget() ? ANY_KIND : OPERATIONS;
        }
        return PRODUCTIONS;
    }

    private static String describeTarget(DeferredReference reference) {
        return reference.hasExplicitTarget() ? reference.explicitTargetId() : reference.key();
    }

    private static String describeExpected(DeferredReference reference) {
        return reference.kind() == ReferenceKind.XREF ? "an operation" : "a production";
    }

    private static String wrongKindRule(DeferredReference reference) {
        return switch (reference.kind()) {
            case XREF -> "invalid-xref";
            case NONTERMINAL -> "wrong-kind-nonterminal";
            case PRODUCTION_REFERENCE -> "invalid-prodref";
        };
    }

    private static String missingRule(DeferredReference reference) {
        return switch (reference.kind()) {
            case XREF -> "invalid-xref";
            case NONTERMINAL -> "undefined-nonterminal";
            case PRODUCTION_REFERENCE -> "invalid-prodref";
        };
    }

    private static String missingMessage(DeferredReference reference) {
        return switch (reference.kind()) {
            case XREF -> reference.hasExplicitTarget()
                ? "can't find clause, production, note or example with id " + reference.explicitTargetId()
                : "can't find abstract op with aoid " + reference.key();
            case NONTERMINAL -> "could not find a definition for nonterminal " + reference.key();
            case PRODUCTION_REFERENCE -> "could not find production named " + reference.key();
        };
    }
}
