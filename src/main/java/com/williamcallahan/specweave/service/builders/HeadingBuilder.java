package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Captures the header of the innermost clause.
 */
public class HeadingBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("h1");
    }

    @Override
    public void enter(TraversalContext context) {
        Element heading = context.node();
        context.currentClause().ifPresent(frame -> {
            if (frame.header() == null && !frame.nestedClauseSeen() && heading.parent() == frame.element()) {
                frame.header(heading);
            }
        });
    }
}
