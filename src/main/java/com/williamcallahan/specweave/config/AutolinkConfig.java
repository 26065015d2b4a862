package com.williamcallahan.specweave.config;

import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.service.linking.AutolinkPolicy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry kinds that plain text is autolinked to.
 */
public class AutolinkConfig {

    private static final String OUTSIDE_KEY = "specweave.autolink.outside-algorithms";
    private static final String INSIDE_KEY = "specweave.autolink.inside-algorithms";
    private static final Set<EntryKind> LINKABLE_KINDS = EnumSet.of(EntryKind.TERM, EntryKind.OPERATION);
    private static final String NULL_LIST_FMT = "%s must not be null.";
    private static final String UNSUPPORTED_KIND_FMT = "%s may only contain TERM and OPERATION, found %s.";

    private List<EntryKind> outsideAlgorithms = new ArrayList<>(List.of(EntryKind.TERM, EntryKind.OPERATION));
    private List<EntryKind> insideAlgorithms = new ArrayList<>(List.of(EntryKind.TERM, EntryKind.OPERATION));

    /**
     * Validates autolink settings.
     */
    public void validateConfiguration() {
        requireLinkable(OUTSIDE_KEY, outsideAlgorithms);
        requireLinkable(INSIDE_KEY, insideAlgorithms);
    }

    /**
     * Builds the policy the autolinker applies.
     *
     * @return autolink policy
     */
    public AutolinkPolicy toPolicy() {
        return new AutolinkPolicy(Set.copyOf(outsideAlgorithms), Set.copyOf(insideAlgorithms));
    }

    public List<EntryKind> getOutsideAlgorithms() {
        return outsideAlgorithms;
    }

    public void setOutsideAlgorithms(final List<EntryKind> outsideAlgorithms) {
        this.outsideAlgorithms = outsideAlgorithms;
    }

    public List<EntryKind> getInsideAlgorithms() {
        return insideAlgorithms;
    }

    public void setInsideAlgorithms(final List<EntryKind> insideAlgorithms) {
        this.insideAlgorithms = insideAlgorithms;
    }

    private static void requireLinkable(final String propertyKey, final List<EntryKind> kinds) {
        if (kinds == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_LIST_FMT, propertyKey));
        }
        for (EntryKind kind : kinds) {
            if (kind == null || !LINKABLE_KINDS.contains(kind)) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, UNSUPPORTED_KIND_FMT, propertyKey, kind));
            }
        }
    }
}
