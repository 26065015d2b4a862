package com.williamcallahan.specweave.service;

import com.williamcallahan.specweave.service.linking.AutolinkPolicy;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings of a compiler instance.
 *
 * @param location URL of the compiled document; null or blank when unknown
 * @param externalBiblios biblio files loaded before every compilation
 * @param autolinkPolicy entry kinds autolinked inside and outside algorithms
 * @param prettyPrint whether the rendered html is indented
 * @param exportBiblio whether a biblio export is requested even without a location
 */
public record CompilerOptions(
    String location,
    List<Path> externalBiblios,
    AutolinkPolicy autolinkPolicy,
    boolean prettyPrint,
    boolean exportBiblio
) {

    public static final String NO_LOCATION_NAMESPACE = "<no location>";

    public CompilerOptions {
        externalBiblios = externalBiblios == null ? List.of() : List.copyOf(externalBiblios);
        autolinkPolicy = autolinkPolicy == null ? AutolinkPolicy.defaults() : autolinkPolicy;
    }

    /**
     * No location, no external biblios, default autolinking, compact output.
     *
     * @return default options
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(null, List.of(), AutolinkPolicy.defaults(), false, false);
    }

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }

    /**
     * Namespace of the compiled document.
     *
     * @return the location, or a placeholder when none is configured
     */
    public String documentNamespace() {
        return hasLocation() ? location : NO_LOCATION_NAMESPACE;
    }
}
