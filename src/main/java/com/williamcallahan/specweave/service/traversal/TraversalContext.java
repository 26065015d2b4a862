package com.williamcallahan.specweave.service.traversal;

import com.williamcallahan.specweave.service.CompilationSession;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Mutable state of one document walk, shared by every builder call.
 */
public class TraversalContext {

    private final CompilationSession session;
    private final ClauseNumberer clauseNumberer = new ClauseNumberer();
    private final Deque<Element> elementStack = new ArrayDeque<>();
    private final Deque<ClauseFrame> clauseStack = new ArrayDeque<>();
    private String currentId;
    private int algorithmDepth;
    private boolean noAutolink;
    private boolean noEmphasis;

    public TraversalContext(CompilationSession session) {
        this.session = session;
    }

    public CompilationSession session() {
        return session;
    }

    /**
     * Element whose builder is running.
     *
     * @return current element
     */
    public Element node() {
        return elementStack.peek();
    }

    /**
     * Parent of the current element on the walk stack.
     *
     * @return parent element, or empty at the root
     */
    public Optional<Element> parent() {
        if (elementStack.size() < 2) {
            return Optional.empty();
        }
        Iterator<Element> iterator = elementStack.iterator();
        iterator.next();
        return Optional.of(iterator.next());
    }

    void pushElement(Element element) {
        elementStack.push(element);
    }

    void popElement() {
        elementStack.pop();
    }

    public ClauseNumberer clauseNumberer() {
        return clauseNumberer;
    }

    public Optional<ClauseFrame> currentClause() {
        return Optional.ofNullable(clauseStack.peek());
    }

    public void pushClause(ClauseFrame frame) {
        clauseStack.push(frame);
    }

    public ClauseFrame popClause() {
        return clauseStack.pop();
    }

    /**
     * Namespace of the innermost clause, or the document namespace outside clauses.
     *
     * @return namespace name
     */
    public String namespace() {
        ClauseFrame frame = clauseStack.peek();
        return frame == null ? session.bibliography().documentNamespace() : frame.namespace();
    }

    public String currentId() {
        return currentId;
    }

    void currentId(String id) {
        this.currentId = id;
    }

    public boolean inAlgorithm() {
        return algorithmDepth > 0;
    }

    public void enterAlgorithm() {
        algorithmDepth++;
    }

    public void exitAlgorithm() {
        algorithmDepth = Math.max(0, algorithmDepth - 1);
    }

    boolean noAutolink() {
        return noAutolink;
    }

    void noAutolink(boolean value) {
        this.noAutolink = value;
    }

    boolean noEmphasis() {
        return noEmphasis;
    }

    void noEmphasis(boolean value) {
        this.noEmphasis = value;
    }
}
