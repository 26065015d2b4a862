package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.ClauseFrame;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.function.Predicate;

/**
 * Base for blocks numbered within their clause, such as examples and notes.
 */
abstract class ClauseScopedBlockBuilder implements Builder {

    private static final String CLAUSE_SELECTOR = "emu-clause, emu-intro, emu-annex";

    /**
     * Counts the blocks of a kind that belong directly to the clause enclosing the current node.
     *
     * @param context walk state
     * @param kind element kind to count
     * @param counted filter for blocks that take part in numbering
     * @return number of such blocks in the clause, including ones not yet visited
     */
    protected static int countInClause(TraversalContext context, String kind, Predicate<Element> counted) {
        Element scope = context.currentClause()
            .map(ClauseFrame::element)
            .orElse(context.session().document().body());
        int count = 0;
        for (Element block : scope.select(kind)) {
            if (counted.test(block) && block.parent() != null
                && block.parent().closest(CLAUSE_SELECTOR) == clauseOrNull(context)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Id of the clause enclosing the current node.
     *
     * @param context walk state
     * @return clause id, or null
     */
    protected static String clauseId(TraversalContext context) {
        Element clause = clauseOrNull(context);
        return clause == null || clause.id().isEmpty() ? null : clause.id();
    }

    private static Element clauseOrNull(TraversalContext context) {
        return context.currentClause().map(ClauseFrame::element).orElse(null);
    }
}
