package com.williamcallahan.specweave.config;

import com.williamcallahan.specweave.service.CompilerOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiler settings bound from {@code specweave.*}.
 */
@Component
@ConfigurationProperties(prefix = "specweave")
public class CompilerProperties {

    private static final String LOCATION_KEY = "specweave.location";
    private static final String BIBLIOS_KEY = "specweave.external-biblios";
    private static final String NULL_FMT = "%s must not be null.";
    private static final String BLANK_ENTRY_FMT = "%s must not contain blank paths.";

    private String location = "";
    private List<String> externalBiblios = new ArrayList<>();
    private AutolinkConfig autolink = new AutolinkConfig();
    private OutputConfig output = new OutputConfig();

    /**
     * Validates every section after binding.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (location == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_FMT, LOCATION_KEY));
        }
        if (externalBiblios == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_FMT, BIBLIOS_KEY));
        }
        for (String biblio : externalBiblios) {
            if (biblio == null || biblio.isBlank()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_ENTRY_FMT, BIBLIOS_KEY));
            }
        }
        autolink.validateConfiguration();
        output.validateConfiguration();
    }

    /**
     * Converts the bound settings into compiler options.
     *
     * @return compiler options
     */
    public CompilerOptions toCompilerOptions() {
        List<Path> biblioPaths = new ArrayList<>();
        for (String biblio : externalBiblios) {
            biblioPaths.add(Path.of(biblio.trim()));
        }
        return new CompilerOptions(location.isBlank() ? null : location.trim(), biblioPaths,
            autolink.toPolicy(), output.isPrettyPrint(), output.hasBiblioFile());
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getExternalBiblios() {
        return externalBiblios;
    }

    public void setExternalBiblios(List<String> externalBiblios) {
        this.externalBiblios = externalBiblios;
    }

    public AutolinkConfig getAutolink() {
        return autolink;
    }

    public void setAutolink(AutolinkConfig autolink) {
        this.autolink = autolink;
    }

    public OutputConfig getOutput() {
        return output;
    }

    public void setOutput(OutputConfig output) {
        this.output = output;
    }
}
