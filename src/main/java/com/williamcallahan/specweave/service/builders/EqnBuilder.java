package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.OperationEntry;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.ClauseFrame;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Defines the operation named by an equation's {@code aoid}.
 */
public class EqnBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-eqn");
    }

    @Override
    public void enter(TraversalContext context) {
        Element eqn = context.node();
        String aoid = eqn.attr("aoid").trim();
        if (aoid.isEmpty()) {
            return;
        }
        String id = eqn.id().isEmpty() ? null : eqn.id();
        String refId = id != null ? null : context.currentClause()
            .map(ClauseFrame::element)
            .map(Element::id)
            .filter(clauseId -> !clauseId.isEmpty())
            .orElse(null);
        if (id == null && refId == null) {
            context.session().reportNode(eqn, "missing-id", "equation defining " + aoid + " needs an id");
            return;
        }
        context.session().define(eqn, new OperationEntry(id, refId, context.namespace(), aoid));
    }
}
