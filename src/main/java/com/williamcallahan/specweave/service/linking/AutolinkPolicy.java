package com.williamcallahan.specweave.service.linking;

import com.williamcallahan.specweave.domain.biblio.EntryKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Entry kinds that plain text may be autolinked to, inside and outside algorithms.
 *
 * @param outsideAlgorithms kinds linked in ordinary prose
 * @param insideAlgorithms kinds linked inside algorithm steps
 */
public record AutolinkPolicy(Set<EntryKind> outsideAlgorithms, Set<EntryKind> insideAlgorithms) {

    public AutolinkPolicy {
        outsideAlgorithms = outsideAlgorithms == null || outsideAlgorithms.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(outsideAlgorithms));
        insideAlgorithms = insideAlgorithms == null || insideAlgorithms.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(insideAlgorithms));
    }

    /**
     * Terms and operations everywhere.
     *
     * @return default policy
     */
    public static AutolinkPolicy defaults() {
        Set<EntryKind> termsAndOperations = EnumSet.of(EntryKind.TERM, EntryKind.OPERATION);
        return new AutolinkPolicy(termsAndOperations, termsAndOperations);
    }

    public Set<EntryKind> kindsFor(boolean inAlgorithm) {
        return inAlgorithm ? insideAlgorithms : outsideAlgorithms;
    }
}
