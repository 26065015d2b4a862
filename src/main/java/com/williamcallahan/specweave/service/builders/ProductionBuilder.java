package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.ProductionEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Defines grammar productions. The first definition of a name in a namespace is the primary
 * one: it receives the {@code prod-Name} anchor, suffixed when another namespace already
 * holds it, and becomes the production entry.
 */
public class ProductionBuilder implements Builder {

    static final String ID_PREFIX = "prod-";

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-production");
    }

    @Override
    public void enter(TraversalContext context) {
        Element production = context.node();
        CompilationSession session = context.session();
        String name = nameOf(production);
        if (name.isEmpty()) {
            session.reportNode(production, "invalid-production", "production has no name");
            return;
        }
        if (!isDefinition(production)) {
            return;
        }
        String namespace = context.namespace();
        if (!session.claimPrimaryProduction(namespace, name)) {
            return;
        }
        if (production.id().isEmpty()) {
            session.assignUniqueNodeId(production, ID_PREFIX + name);
        }
        session.define(production, new ProductionEntry(production.id(), namespace, name));
    }

    static String nameOf(Element production) {
        String name = production.attr("name").trim();
        if (!name.isEmpty()) {
            return name;
        }
        Element definingNonTerminal = production.selectFirst("> emu-nt");
        return definingNonTerminal == null ? "" : definingNonTerminal.ownText().trim();
    }

    private static boolean isDefinition(Element production) {
        Element grammar = production.closest("emu-grammar");
        return grammar == null || "definition".equals(grammar.attr("type"));
    }
}
