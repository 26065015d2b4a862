package com.williamcallahan.specweave.service.biblio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.specweave.domain.biblio.BiblioEntry;
import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;
import com.williamcallahan.specweave.service.BiblioLoadException;
import com.williamcallahan.specweave.service.SpecCompilationException;
import com.williamcallahan.specweave.service.diagnostics.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads external biblio tables and writes the export of a compiled document.
 *
 * <p>Both directions use the same shape: an object keyed by document location whose values
 * are arrays of entries tagged with a {@code type} property. Entries of unknown types are
 * skipped on read.</p>
 */
public class BiblioJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(BiblioJsonCodec.class);
    private static final TypeReference<Map<String, List<BiblioEntry>>> TABLES_TYPE = new TypeReference<>() {};
    private static final String REFERENCING_IDS = "referencingIds";

    private final ObjectMapper mapper;

    public BiblioJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec on a copy of an existing mapper.
     *
     * @param objectMapper base mapper
     */
    public BiblioJsonCodec(ObjectMapper objectMapper) {
        this.mapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads biblio tables from a file.
     *
     * @param file JSON file
     * @return location to entries, in file order
     * @throws BiblioLoadException if the file cannot be read or parsed
     */
    public Map<String, List<BiblioEntry>> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, List<BiblioEntry>> tables = read(in);
            log.info("Loaded {} biblio table(s) from {}", tables.size(), file);
            return tables;
        } catch (IOException e) {
            throw new BiblioLoadException("Failed to read biblio file " + file, e);
        }
    }

    /**
     * Reads biblio tables from a stream.
     *
     * @param in JSON content
     * @return location to entries, in stream order
     * @throws IOException if the content is not a valid biblio document
     */
    public Map<String, List<BiblioEntry>> read(InputStream in) throws IOException {
        Map<String, List<BiblioEntry>> raw = mapper.readValue(in, TABLES_TYPE);
        Map<String, List<BiblioEntry>> tables = new LinkedHashMap<>();
        if (raw == null) {
            return tables;
        }
        raw.forEach((location, entries) -> {
            List<BiblioEntry> known = new ArrayList<>();
            if (entries != null) {
                for (BiblioEntry entry : entries) {
                    if (entry != null) {
                        known.add(entry);
                    }
                }
            }
            tables.put(location, known);
        });
        return tables;
    }

    /**
     * Serializes the local entries of a bibliography with their back-references.
     *
     * @param bibliography compiled bibliography
     * @param location document location used as the top-level key
     * @param sink receives a diagnostic when no location is configured
     * @param prettyPrint whether to indent the output
     * @return JSON text; {@code {}} when the document has no location
     */
    public String export(Bibliography bibliography, String location, DiagnosticSink sink, boolean prettyPrint) {
        if (location == null || location.isBlank()) {
            sink.report(Diagnostic.global("no-location",
                "a location is required to export the biblio; set specweave.location"));
            return "{}";
        }
        ObjectNode root = mapper.createObjectNode();
        ArrayNode entries = root.putArray(location);
        for (BiblioEntry entry : bibliography.entries()) {
            ObjectNode node = mapper.valueToTree(entry);
            if (entry.id() != null) {
                node.set(REFERENCING_IDS, mapper.valueToTree(bibliography.referencingIds(entry.id())));
            }
            entries.add(node);
        }
        try {
            return prettyPrint
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root)
                : mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new SpecCompilationException("Failed to serialize biblio export", e);
        }
    }
}
