package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.linking.DeferredReference;
import com.williamcallahan.specweave.service.linking.ReferenceKind;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Records production references; they are replaced by a copy of the named production once
 * all productions are known.
 */
public class ProdRefBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-prodref");
    }

    @Override
    public void enter(TraversalContext context) {
        Element prodRef = context.node();
        String name = prodRef.attr("name").trim();
        if (name.isEmpty()) {
            context.session().reportAttribute(prodRef, "name", "invalid-prodref", "production reference has no name");
            return;
        }
        context.session().addDeferredReference(new DeferredReference(
            ReferenceKind.PRODUCTION_REFERENCE, prodRef, null, name, context.namespace()));
    }
}
