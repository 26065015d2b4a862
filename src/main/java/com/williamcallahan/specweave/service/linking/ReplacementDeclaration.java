package com.williamcallahan.specweave.service.linking;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * An algorithm that replaces a single step of another algorithm.
 *
 * @param algorithm the replacing {@code emu-alg}
 * @param targetStepId id of the replaced step
 * @param containedStepIds labeled steps of the replacing algorithm, outermost first
 */
public record ReplacementDeclaration(Element algorithm, String targetStepId, List<String> containedStepIds) {

    public ReplacementDeclaration {
        containedStepIds = containedStepIds == null ? List.of() : List.copyOf(containedStepIds);
    }
}
