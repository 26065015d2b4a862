package com.williamcallahan.specweave.service.biblio;

import com.williamcallahan.specweave.domain.biblio.EntryRef;

import java.util.List;

/**
 * Outcome of a bibliography lookup.
 */
public sealed interface LookupResult
    permits LookupResult.Found, LookupResult.Ambiguous, LookupResult.WrongKind, LookupResult.Missing {

    /**
     * Exactly one entry of an accepted kind matched.
     *
     * @param ref the match
     */
    record Found(EntryRef ref) implements LookupResult {}

    /**
     * Several entries of an accepted kind matched at the same namespace level.
     *
     * @param candidates every candidate, in definition order
     */
    record Ambiguous(List<EntryRef> candidates) implements LookupResult {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * Only entries of other kinds matched.
     *
     * @param ref nearest entry that matched by id or key
     */
    record WrongKind(EntryRef ref) implements LookupResult {}

    /**
     * Nothing matched.
     */
    record Missing() implements LookupResult {}
}
