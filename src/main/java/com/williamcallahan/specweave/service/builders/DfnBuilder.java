package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.TermEntry;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.ClauseFrame;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import com.williamcallahan.specweave.support.TextKeyNormalizer;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Defines terms. A term links to its own {@code dfn} when it has an id, otherwise to the
 * enclosing clause.
 */
public class DfnBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("dfn");
    }

    @Override
    public void enter(TraversalContext context) {
    }

    @Override
    public void exit(TraversalContext context) {
        Element dfn = context.node();
        String term = TextKeyNormalizer.normalize(dfn.text());
        if (term.isEmpty()) {
            context.session().reportNode(dfn, "empty-dfn", "dfn has no text");
            return;
        }
        String id = dfn.id().isEmpty() ? null : dfn.id();
        String refId = context.currentClause()
            .map(ClauseFrame::element)
            .map(Element::id)
            .filter(clauseId -> !clauseId.isEmpty())
            .orElse(null);
        if (id == null && refId == null) {
            context.session().reportNode(dfn, "missing-id", "term \"" + term + "\" has no id and no enclosing clause id");
            return;
        }
        context.session().define(dfn, new TermEntry(id, id == null ? refId : null, context.namespace(), term, variants(dfn)));
    }

    private static List<String> variants(Element dfn) {
        List<String> variants = new ArrayList<>();
        for (String variant : dfn.attr("variants").split(",")) {
            String normalized = TextKeyNormalizer.normalize(variant);
            if (!normalized.isEmpty()) {
                variants.add(normalized);
            }
        }
        return variants;
    }
}
