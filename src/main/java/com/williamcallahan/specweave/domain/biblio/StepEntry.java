package com.williamcallahan.specweave.domain.biblio;

import java.util.List;

/**
 * A labeled algorithm step.
 *
 * @param id step id
 * @param namespace namespace of the enclosing clause
 * @param stepNumbers path from the outermost list down, e.g. {@code [2, 1, 3]}
 */
public record StepEntry(String id, String namespace, List<Integer> stepNumbers) implements BiblioEntry {

    public StepEntry {
        if (stepNumbers == null || stepNumbers.isEmpty()) {
            throw new IllegalArgumentException("Step path cannot be null or empty");
        }
        stepNumbers = List.copyOf(stepNumbers);
    }

    @Override
    public EntryKind kind() {
        return EntryKind.STEP;
    }

    /**
     * Returns a copy with a finalized path.
     *
     * @param path new step path
     * @return new StepEntry instance
     */
    public StepEntry withStepNumbers(List<Integer> path) {
        return new StepEntry(id, namespace, path);
    }
}
