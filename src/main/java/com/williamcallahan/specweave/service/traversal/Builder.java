package com.williamcallahan.specweave.service.traversal;

import java.util.Set;

/**
 * Handles one or more element kinds during the document walk.
 *
 * <p>{@link #enter} runs before the element's children are visited and may insert nodes
 * as children or later siblings of the element; those nodes are visited in the same walk.
 * {@link #exit} runs after every descendant was visited.</p>
 */
public interface Builder {

    /**
     * Lowercase element names this builder handles.
     *
     * @return element kinds
     */
    Set<String> elementKinds();

    /**
     * Called when the walk reaches an element of a handled kind.
     *
     * @param context walk state; {@link TraversalContext#node()} is the element
     */
    void enter(TraversalContext context);

    /**
     * Called when the walk leaves the element.
     *
     * @param context walk state; {@link TraversalContext#node()} is the element
     */
    default void exit(TraversalContext context) {
    }
}
