package com.williamcallahan.specweave.service.linking;

import org.jsoup.nodes.Element;

/**
 * A reference recorded during the walk and resolved once the bibliography is complete.
 *
 * @param kind reference kind
 * @param node referring element
 * @param explicitTargetId target id given by the author, or null
 * @param key textual key used when no id is given
 * @param namespace namespace the reference appears in
 */
public record DeferredReference(ReferenceKind kind, Element node, String explicitTargetId, String key, String namespace) {

    public boolean hasExplicitTarget() {
        return explicitTargetId != null && !explicitTargetId.isEmpty();
    }
}
