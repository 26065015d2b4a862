package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.ExampleEntry;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Numbers examples within their clause. A clause with a single example leaves it unnumbered.
 */
public class ExampleBuilder extends ClauseScopedBlockBuilder {

    private static final String KIND = "emu-example";

    @Override
    public Set<String> elementKinds() {
        return Set.of(KIND);
    }

    @Override
    public void enter(TraversalContext context) {
        Element example = context.node();
        int number = context.currentClause().map(frame -> frame.nextExampleNumber())
            .orElseGet(() -> context.session().nextCount(KIND));
        int total = countInClause(context, KIND, block -> true);

        StringBuilder caption = new StringBuilder("Example");
        if (total > 1) {
            caption.append(' ').append(number);
        }
        String title = example.attr("caption").trim();
        if (!title.isEmpty()) {
            caption.append(": ").append(title);
        }
        example.prependChild(new Element("figcaption").text(caption.toString()));
        example.removeAttr("caption");

        if (!example.id().isEmpty()) {
            context.session().define(example,
                new ExampleEntry(example.id(), context.namespace(), number, clauseId(context)));
        }
    }
}
