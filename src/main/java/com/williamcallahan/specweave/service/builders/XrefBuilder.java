package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.linking.DeferredReference;
import com.williamcallahan.specweave.service.linking.ReferenceKind;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Records cross-references for resolution after the walk.
 */
public class XrefBuilder implements Builder {

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-xref");
    }

    @Override
    public void enter(TraversalContext context) {
        Element xref = context.node();
        CompilationSession session = context.session();
        String href = xref.attr("href").trim();
        String aoid = xref.attr("aoid").trim();

        if (!href.isEmpty()) {
            if (!href.startsWith("#") || href.length() == 1) {
                session.reportAttribute(xref, "href", "invalid-xref",
                    "xref to anything other than a fragment id is not supported");
                return;
            }
            session.addDeferredReference(new DeferredReference(
                ReferenceKind.XREF, xref, href.substring(1), null, context.namespace()));
        } else if (!aoid.isEmpty()) {
            session.addDeferredReference(new DeferredReference(
                ReferenceKind.XREF, xref, null, aoid, context.namespace()));
        } else {
            session.reportNode(xref, "invalid-xref", "xref has neither href nor aoid");
        }
    }
}
