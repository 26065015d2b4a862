package com.williamcallahan.specweave.service.biblio;

import com.williamcallahan.specweave.domain.biblio.BiblioEntry;
import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.domain.biblio.EntryRef;
import com.williamcallahan.specweave.domain.biblio.StepEntry;
import com.williamcallahan.specweave.support.TextKeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Namespaced registry of every entry the document defines, plus read-only tables
 * imported from other documents.
 *
 * <p>Ids are unique across the whole document regardless of namespace. Textual lookups
 * walk a fixed chain: the requested namespace and its ancestors, then {@value #GLOBAL_NAMESPACE},
 * then the external tables in import order.</p>
 */
public class Bibliography {

    public static final String GLOBAL_NAMESPACE = "global";

    private static final Logger log = LoggerFactory.getLogger(Bibliography.class);
    private static final Set<EntryKind> ANY_KIND = Collections.unmodifiableSet(EnumSet.allOf(EntryKind.class));

    private final String documentNamespace;
    private final Map<String, String> parentNamespaces = new HashMap<>();
    private final List<BiblioEntry> entries = new ArrayList<>();
    private final Map<String, BiblioEntry> entriesById = new HashMap<>();
    private final Map<String, Map<String, List<BiblioEntry>>> entriesByNamespace = new HashMap<>();
    private final Map<String, Set<String>> referencingIds = new HashMap<>();
    private final Map<String, ExternalTable> externalTables = new LinkedHashMap<>();

    /**
     * Creates an empty bibliography.
     *
     * @param documentNamespace namespace of the compiled document; its parent is the global namespace
     */
    public Bibliography(String documentNamespace) {
        this.documentNamespace = Objects.requireNonNull(documentNamespace, "documentNamespace");
        parentNamespaces.put(GLOBAL_NAMESPACE, null);
        if (!GLOBAL_NAMESPACE.equals(documentNamespace)) {
            parentNamespaces.put(documentNamespace, GLOBAL_NAMESPACE);
        }
    }

    public String documentNamespace() {
        return documentNamespace;
    }

    /**
     * Declares a namespace nested in another one. Re-declaring an existing namespace is a no-op.
     *
     * @param namespace new namespace
     * @param parent enclosing namespace
     */
    public void createNamespace(String namespace, String parent) {
        if (parentNamespaces.containsKey(namespace)) {
            return;
        }
        parentNamespaces.put(namespace, parentNamespaces.containsKey(parent) ? parent : documentNamespace);
    }

    /**
     * Adds an entry.
     *
     * @param entry entry to add
     * @throws DuplicateIdException if the entry's id is already taken
     */
    public void define(BiblioEntry entry) throws DuplicateIdException {
        Objects.requireNonNull(entry, "entry");
        String id = entry.id();
        if (id != null) {
            BiblioEntry existing = entriesById.get(id);
            if (existing != null) {
                throw new DuplicateIdException(id, existing.kind());
            }
            entriesById.put(id, entry);
        }
        createNamespace(entry.namespace(), documentNamespace);
        entries.add(entry);
        Map<String, List<BiblioEntry>> keyed = entriesByNamespace.computeIfAbsent(entry.namespace(), ns -> new HashMap<>());
        for (String key : normalizedKeys(entry)) {
            keyed.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        log.debug("Defined {} {} in namespace {}", entry.kind().label(), describe(entry), entry.namespace());
    }

    /**
     * Merges a table of entries exported by another document. External entries never
     * receive back-references and never collide with local ids.
     *
     * @param location location key of the other document
     * @param externalEntries its entries
     */
    public void importExternal(String location, List<BiblioEntry> externalEntries) {
        ExternalTable table = externalTables.computeIfAbsent(location, ExternalTable::new);
        for (BiblioEntry entry : externalEntries) {
            if (entry != null) {
                table.add(entry);
            }
        }
        log.debug("Imported {} external entries for {}", externalEntries.size(), location);
    }

    /**
     * Finds an entry by id, local entries first.
     *
     * @param id entry id
     * @return the entry, or empty
     */
    public Optional<EntryRef> byId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        BiblioEntry local = entriesById.get(id);
        if (local != null) {
            return Optional.of(EntryRef.local(local));
        }
        for (ExternalTable table : externalTables.values()) {
            BiblioEntry external = table.entriesById.get(id);
            if (external != null) {
                return Optional.of(new EntryRef(external, table.location));
            }
        }
        return Optional.empty();
    }

    /**
     * Finds an entry of any kind by textual key.
     *
     * @param namespace namespace the lookup starts in
     * @param key term, operation or production name
     * @return lookup outcome
     */
    public LookupResult lookup(String namespace, String key) {
        return lookup(namespace, null, key, ANY_KIND);
    }

    /**
     * Finds an entry by explicit id when one is given, otherwise by textual key.
     *
     * @param namespace namespace the keyed lookup starts in
     * @param explicitId id to resolve, or null
     * @param key textual key used when no id is given
     * @param kinds acceptable entry kinds
     * @return lookup outcome
     */
    public LookupResult lookup(String namespace, String explicitId, String key, Set<EntryKind> kinds) {
        if (explicitId != null && !explicitId.isEmpty()) {
            Optional<EntryRef> byId = byId(explicitId);
            if (byId.isEmpty()) {
                return new LookupResult.Missing();
            }
            return kinds.contains(byId.get().entry().kind())
                ? new LookupResult.Found(byId.get())
                : new LookupResult.WrongKind(byId.get());
        }

        String normalized = TextKeyNormalizer.normalize(key);
        if (normalized.isEmpty()) {
            return new LookupResult.Missing();
        }
        EntryRef nearestOtherKind = null;
        for (String ns : namespaceChain(namespace)) {
            List<BiblioEntry> candidates = entriesByNamespace.getOrDefault(ns, Map.of()).getOrDefault(normalized, List.of());
            List<EntryRef> matching = new ArrayList<>();
            for (BiblioEntry candidate : candidates) {
                if (kinds.contains(candidate.kind())) {
                    matching.add(EntryRef.local(candidate));
                }
            }
            if (matching.size() == 1) {
                return new LookupResult.Found(matching.get(0));
            }
            if (matching.size() > 1) {
                return new LookupResult.Ambiguous(matching);
            }
            if (nearestOtherKind == null && !candidates.isEmpty()) {
                nearestOtherKind = EntryRef.local(candidates.get(0));
            }
        }
        for (ExternalTable table : externalTables.values()) {
            List<BiblioEntry> candidates = table.entriesByKey.getOrDefault(normalized, List.of());
            List<EntryRef> matching = new ArrayList<>();
            for (BiblioEntry candidate : candidates) {
                if (kinds.contains(candidate.kind())) {
                    matching.add(new EntryRef(candidate, table.location));
                }
            }
            if (matching.size() == 1) {
                return new LookupResult.Found(matching.get(0));
            }
            if (matching.size() > 1) {
                return new LookupResult.Ambiguous(matching);
            }
            if (nearestOtherKind == null && !candidates.isEmpty()) {
                nearestOtherKind = new EntryRef(candidates.get(0), table.location);
            }
        }
        return nearestOtherKind == null ? new LookupResult.Missing() : new LookupResult.WrongKind(nearestOtherKind);
    }

    /**
     * Collects every key visible from a namespace, with the candidates found at the nearest
     * level that defines it. A key with more than one candidate is ambiguous.
     *
     * @param namespace namespace the text lives in
     * @param kinds entry kinds to include
     * @return key to candidates, nearest definitions first
     */
    public Map<String, List<EntryRef>> visibleEntries(String namespace, Set<EntryKind> kinds) {
        Map<String, List<EntryRef>> visible = new LinkedHashMap<>();
        for (String ns : namespaceChain(namespace)) {
            Map<String, List<EntryRef>> level = new LinkedHashMap<>();
            entriesByNamespace.getOrDefault(ns, Map.of()).forEach((key, candidates) -> {
                for (BiblioEntry candidate : candidates) {
                    if (kinds.contains(candidate.kind())) {
                        level.computeIfAbsent(key, k -> new ArrayList<>()).add(EntryRef.local(candidate));
                    }
                }
            });
            level.forEach(visible::putIfAbsent);
        }
        for (ExternalTable table : externalTables.values()) {
            Map<String, List<EntryRef>> level = new LinkedHashMap<>();
            table.entriesByKey.forEach((key, candidates) -> {
                for (BiblioEntry candidate : candidates) {
                    if (kinds.contains(candidate.kind())) {
                        level.computeIfAbsent(key, k -> new ArrayList<>()).add(new EntryRef(candidate, table.location));
                    }
                }
            });
            level.forEach(visible::putIfAbsent);
        }
        return visible;
    }

    /**
     * Records that an element refers to an entry. Repeated calls with the same pair have no effect.
     *
     * @param entryId id of a local entry
     * @param referringId id of the referring element
     * @return false when the entry is not a local one
     */
    public boolean recordReference(String entryId, String referringId) {
        if (entryId == null || !entriesById.containsKey(entryId)) {
            return false;
        }
        referencingIds.computeIfAbsent(entryId, id -> new LinkedHashSet<>()).add(referringId);
        return true;
    }

    public List<String> referencingIds(String entryId) {
        return List.copyOf(referencingIds.getOrDefault(entryId, Set.of()));
    }

    /**
     * Finds a local step entry.
     *
     * @param id step id
     * @return the step, or empty when absent or not a step
     */
    public Optional<StepEntry> stepEntry(String id) {
        return entriesById.get(id) instanceof StepEntry step ? Optional.of(step) : Optional.empty();
    }

    /**
     * Replaces the path of a local step with its final value.
     *
     * @param stepId step id
     * @param stepNumbers final path
     * @return the updated entry
     */
    public StepEntry replaceStepNumbers(String stepId, List<Integer> stepNumbers) {
        StepEntry current = stepEntry(stepId)
            .orElseThrow(() -> new IllegalArgumentException("No step entry with id " + stepId));
        StepEntry updated = current.withStepNumbers(stepNumbers);
        entriesById.put(stepId, updated);
        int position = entries.indexOf(current);
        if (position >= 0) {
            entries.set(position, updated);
        }
        return updated;
    }

    /**
     * Returns the local entries in definition order.
     *
     * @return snapshot of local entries
     */
    public List<BiblioEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Returns the lookup chain of a namespace: itself, its ancestors, then the global namespace.
     *
     * @param namespace starting namespace
     * @return namespaces in lookup order
     */
    public List<String> namespaceChain(String namespace) {
        List<String> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String current = parentNamespaces.containsKey(namespace) ? namespace : documentNamespace;
        if (!current.equals(namespace) && namespace != null) {
            chain.add(namespace);
            seen.add(namespace);
        }
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = parentNamespaces.get(current);
        }
        if (!seen.contains(GLOBAL_NAMESPACE)) {
            chain.add(GLOBAL_NAMESPACE);
        }
        return chain;
    }

    private static Set<String> normalizedKeys(BiblioEntry entry) {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : entry.lookupKeys()) {
            String normalized = TextKeyNormalizer.normalize(key);
            if (!normalized.isEmpty()) {
                keys.add(normalized);
            }
        }
        return keys;
    }

    private static String describe(BiblioEntry entry) {
        List<String> keys = entry.lookupKeys();
        return keys.isEmpty() ? String.valueOf(entry.id()) : keys.get(0);
    }

    /**
     * Entries exported by one other document.
     */
    private static final class ExternalTable {
        private final String location;
        private final Map<String, BiblioEntry> entriesById = new HashMap<>();
        private final Map<String, List<BiblioEntry>> entriesByKey = new HashMap<>();

        private ExternalTable(String location) {
            this.location = location;
        }

        private void add(BiblioEntry entry) {
            if (entry.id() != null) {
                entriesById.putIfAbsent(entry.id(), entry);
            }
            for (String key : normalizedKeys(entry)) {
                entriesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
            }
        }
    }
}
