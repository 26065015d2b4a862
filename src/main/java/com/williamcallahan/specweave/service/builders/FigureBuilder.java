package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.FigureEntry;
import com.williamcallahan.specweave.domain.biblio.TableEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Numbers figures and tables across the whole document and renders their captions.
 */
public class FigureBuilder implements Builder {

    private static final String TABLE_KIND = "emu-table";

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-figure", TABLE_KIND);
    }

    @Override
    public void enter(TraversalContext context) {
        Element figure = context.node();
        CompilationSession session = context.session();
        boolean table = TABLE_KIND.equals(figure.normalName()) || "table".equals(figure.attr("type"));
        String label = table ? "Table" : "Figure";
        int number = session.nextCount(label);

        String caption = figure.attr("caption").trim();
        StringBuilder captionText = new StringBuilder(label).append(' ').append(number);
        if (figure.hasAttr("informative")) {
            captionText.append(" (Informative)");
        }
        if (!caption.isEmpty()) {
            captionText.append(": ").append(caption);
        }
        figure.prependChild(new Element("figcaption").text(captionText.toString()));
        figure.removeAttr("caption");

        if (figure.id().isEmpty()) {
            return;
        }
        String captionOrNull = caption.isEmpty() ? null : caption;
        if (table) {
            session.define(figure, new TableEntry(figure.id(), context.namespace(), number, captionOrNull));
        } else {
            session.define(figure, new FigureEntry(figure.id(), context.namespace(), number, captionOrNull));
        }
    }
}
