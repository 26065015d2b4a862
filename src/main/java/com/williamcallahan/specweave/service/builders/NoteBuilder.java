package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.NoteEntry;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Labels notes. Notes are numbered within their clause when it has more than one; editor's
 * notes are never numbered.
 */
public class NoteBuilder extends ClauseScopedBlockBuilder {

    private static final String KIND = "emu-note";

    @Override
    public Set<String> elementKinds() {
        return Set.of(KIND);
    }

    @Override
    public void enter(TraversalContext context) {
        Element note = context.node();
        if ("editor".equals(note.attr("type"))) {
            note.prependChild(new Element("span").addClass("note").text("Editor's Note"));
            return;
        }
        int number = context.currentClause().map(frame -> frame.nextNoteNumber())
            .orElseGet(() -> context.session().nextCount(KIND));
        int total = countInClause(context, KIND, block -> !"editor".equals(block.attr("type")));
        note.prependChild(new Element("span").addClass("note").text(total > 1 ? "Note " + number : "Note"));

        if (!note.id().isEmpty()) {
            context.session().define(note, new NoteEntry(note.id(), context.namespace(), number, clauseId(context)));
        }
    }
}
