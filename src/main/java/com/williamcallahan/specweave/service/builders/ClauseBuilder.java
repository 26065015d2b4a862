package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.OutlineEntry;
import com.williamcallahan.specweave.domain.biblio.ClauseEntry;
import com.williamcallahan.specweave.domain.biblio.OperationEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.ClauseFrame;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import com.williamcallahan.specweave.support.TextKeyNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Numbers clauses, opens their namespaces, and defines their entries once their content is known.
 */
public class ClauseBuilder implements Builder {

    private static final Logger log = LoggerFactory.getLogger(ClauseBuilder.class);

    private static final Set<String> KINDS = Set.of("emu-clause", "emu-intro", "emu-annex");

    @Override
    public Set<String> elementKinds() {
        return KINDS;
    }

    @Override
    public void enter(TraversalContext context) {
        Element clause = context.node();
        CompilationSession session = context.session();
        ClauseFrame parent = context.currentClause().orElse(null);
        if (parent != null) {
            parent.markNestedClause();
        }

        String number = context.clauseNumberer().assign(parent, clause.normalName());
        if (number == null) {
            session.reportNode(clause, "clause-after-annex", "clauses cannot follow annexes");
            number = "";
        }

        String parentNamespace = context.namespace();
        String namespace = parentNamespace;
        String declaredNamespace = clause.attr("namespace").trim();
        if (!declaredNamespace.isEmpty()) {
            namespace = declaredNamespace;
            session.bibliography().createNamespace(namespace, parentNamespace);
        }
        context.pushClause(new ClauseFrame(clause, namespace, number));
    }

    @Override
    public void exit(TraversalContext context) {
        ClauseFrame frame = context.popClause();
        Element clause = frame.element();
        CompilationSession session = context.session();
        String parentNamespace = context.namespace();

        Element header = frame.header();
        Element renderedNumber = header == null ? null : renderedSectionNumber(header);
        String title = header == null ? null : headerTitle(header, renderedNumber);
        if (header != null && !frame.number().isEmpty()) {
            if (renderedNumber != null) {
                renderedNumber.text(frame.number());
            } else {
                header.prependChild(new TextNode(" "));
                header.prependChild(new Element("span").addClass("secnum").text(frame.number()));
            }
        }

        String id = clause.id().isEmpty() ? null : clause.id();
        String aoid = clause.attr("aoid").trim();
        if (id != null) {
            session.define(clause, new ClauseEntry(id, parentNamespace, aoid.isEmpty() ? null : aoid, title, frame.number()));
            if (!aoid.isEmpty()) {
                session.define(clause, new OperationEntry(null, id, parentNamespace, aoid));
            }
        } else if (!aoid.isEmpty()) {
            session.reportNode(clause, "missing-id", "clause defining " + aoid + " needs an id");
        }

        OutlineEntry outlineEntry = new OutlineEntry(id, frame.number(), title, frame.children());
        context.currentClause().ifPresentOrElse(
            enclosing -> enclosing.children().add(outlineEntry),
            () -> session.addTopLevelClause(outlineEntry));
        log.debug("Clause {} {} closed", frame.number(), id);
    }

    /**
     * Finds the section number left by an earlier compilation of the same header.
     */
    private static Element renderedSectionNumber(Element header) {
        if (header.childNodeSize() == 0) {
            return null;
        }
        Node first = header.childNode(0);
        if (first instanceof Element element && "span".equals(element.normalName()) && element.hasClass("secnum")) {
            return element;
        }
        return null;
    }

    private static String headerTitle(Element header, Element renderedNumber) {
        if (renderedNumber == null) {
            return TextKeyNormalizer.normalize(header.text());
        }
        Element copy = header.clone();
        copy.childNode(0).remove();
        return TextKeyNormalizer.normalize(copy.text());
    }
}
