package com.williamcallahan.specweave.service.traversal;

import com.williamcallahan.specweave.service.SpecStructureException;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed mapping from element kind to the builder that handles it.
 */
public class BuilderRegistry {

    private final Map<String, Builder> buildersByKind;

    /**
     * Registers every kind of every builder.
     *
     * @param builders builders to register
     * @throws SpecStructureException if two builders claim the same kind
     */
    public BuilderRegistry(List<? extends Builder> builders) {
        Map<String, Builder> byKind = new HashMap<>();
        for (Builder builder : builders) {
            for (String kind : builder.elementKinds()) {
                String normalized = kind.toLowerCase(Locale.ROOT);
                Builder previous = byKind.putIfAbsent(normalized, builder);
                if (previous != null) {
                    throw new SpecStructureException("Element kind " + normalized + " is handled by both "
                        + previous.getClass().getSimpleName() + " and " + builder.getClass().getSimpleName());
                }
            }
        }
        this.buildersByKind = Map.copyOf(byKind);
    }

    public Optional<Builder> builderFor(String kind) {
        return Optional.ofNullable(buildersByKind.get(kind));
    }

    public int size() {
        return buildersByKind.size();
    }
}
