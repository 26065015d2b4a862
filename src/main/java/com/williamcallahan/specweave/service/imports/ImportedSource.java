package com.williamcallahan.specweave.service.imports;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Source text of a file whose content was inlined into the tree.
 *
 * @param file path of the file as it should appear in diagnostics
 * @param source full source text the inlined nodes were parsed from
 */
public record ImportedSource(Path file, String source) {

    public ImportedSource {
        Objects.requireNonNull(file, "Import file is required");
        Objects.requireNonNull(source, "Import source is required");
    }
}
