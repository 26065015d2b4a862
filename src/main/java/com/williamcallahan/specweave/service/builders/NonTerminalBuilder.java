package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.linking.DeferredReference;
import com.williamcallahan.specweave.service.linking.ReferenceKind;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Records non-terminal references. Non-terminals already holding a link are left alone.
 */
public class NonTerminalBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-nt");
    }

    @Override
    public void enter(TraversalContext context) {
        Element nonTerminal = context.node();
        if (nonTerminal.selectFirst("> a") != null) {
            return;
        }
        String name = nonTerminal.ownText().trim();
        if (name.isEmpty()) {
            return;
        }
        context.session().addDeferredReference(new DeferredReference(
            ReferenceKind.NONTERMINAL, nonTerminal, null, name, context.namespace()));
    }
}
