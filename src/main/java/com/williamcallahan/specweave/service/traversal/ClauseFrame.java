package com.williamcallahan.specweave.service.traversal;

import com.williamcallahan.specweave.domain.OutlineEntry;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * An open clause on the walk's clause stack.
 */
public class ClauseFrame {

    private final Element element;
    private final String namespace;
    private final String number;
    private final List<OutlineEntry> children = new ArrayList<>();
    private Element header;
    private boolean nestedClauseSeen;
    private int childClauseCount;
    private int exampleCount;
    private int noteCount;

    /**
     * Opens a frame.
     *
     * @param element clause element
     * @param namespace namespace the clause's content is looked up in
     * @param number dotted section number, empty when unnumbered
     */
    public ClauseFrame(Element element, String namespace, String number) {
        this.element = element;
        this.namespace = namespace;
        this.number = number;
    }

    public Element element() {
        return element;
    }

    public String namespace() {
        return namespace;
    }

    public String number() {
        return number;
    }

    public Element header() {
        return header;
    }

    public void header(Element header) {
        this.header = header;
    }

    /**
     * Whether a nested clause was opened inside this one; headers after that point belong to no clause.
     *
     * @return true once a child clause has been entered
     */
    public boolean nestedClauseSeen() {
        return nestedClauseSeen;
    }

    public void markNestedClause() {
        this.nestedClauseSeen = true;
    }

    int nextChildClauseNumber() {
        return ++childClauseCount;
    }

    public int nextExampleNumber() {
        return ++exampleCount;
    }

    public int nextNoteNumber() {
        return ++noteCount;
    }

    public List<OutlineEntry> children() {
        return children;
    }
}
