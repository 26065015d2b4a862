package com.williamcallahan.specweave.config;

import java.util.Locale;

/**
 * Rendering and export settings.
 */
public class OutputConfig {

    private static final String BIBLIO_FILE_KEY = "specweave.output.biblio-file";
    private static final String NULL_TEXT_FMT = "%s must not be null.";

    private boolean prettyPrint = false;
    private String biblioFile = "";

    /**
     * Validates output settings.
     */
    public void validateConfiguration() {
        if (biblioFile == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, BIBLIO_FILE_KEY));
        }
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(final boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String getBiblioFile() {
        return biblioFile;
    }

    public void setBiblioFile(final String biblioFile) {
        this.biblioFile = biblioFile;
    }

    public boolean hasBiblioFile() {
        return biblioFile != null && !biblioFile.isBlank();
    }
}
