package com.williamcallahan.specweave.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.specweave.config.CompilerProperties;
import com.williamcallahan.specweave.service.CompilerOptions;
import com.williamcallahan.specweave.service.SpecCompiler;
import com.williamcallahan.specweave.service.biblio.BiblioJsonCodec;
import com.williamcallahan.specweave.service.grammar.SimpleGrammarEngine;
import com.williamcallahan.specweave.service.imports.FileImportLoader;
import com.williamcallahan.specweave.service.linking.AutolinkPolicy;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * Runs the command against files in a temporary directory.
 */
class CompileCommandTest {

    private static final String LOCATION = "https://example.com/spec/";
    private static final String SOURCE = "<emu-clause id=\"sec-intro\"><h1>Intro</h1><p>See <emu-xref href=\"#sec-intro\"></emu-xref>.</p></emu-clause>";

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private CompilerProperties properties;
    private CompileCommand command;

    @BeforeEach
    void setUp() {
        properties = new CompilerProperties();
        CompilerOptions options = new CompilerOptions(LOCATION, List.of(), AutolinkPolicy.defaults(), false, false);
        SpecCompiler compiler = new SpecCompiler(options, new SimpleGrammarEngine(), new FileImportLoader(),
            new BiblioJsonCodec(new ObjectMapper()));
        command = new CompileCommand(compiler, properties, new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    private Path input() throws IOException {
        Path file = workDir.resolve("spec.html");
        Files.writeString(file, SOURCE, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void writesHtmlToStdoutWithoutOutputPath() throws IOException {
        command.run(new DefaultApplicationArguments(input().toString()));

        assertEquals(CompileCommand.EXIT_OK, command.getExitCode());
        String html = captured.toString(StandardCharsets.UTF_8);
        assertTrue(html.startsWith("<!doctype html>"), html);
        assertTrue(html.contains("href=\"#sec-intro\""), html);
    }

    @Test
    void writesHtmlToOutputFileCreatingDirectories() throws IOException {
        Path output = workDir.resolve("out/nested/index.html");

        command.run(new DefaultApplicationArguments(input().toString(), output.toString()));

        assertEquals(CompileCommand.EXIT_OK, command.getExitCode());
        assertTrue(Files.readString(output, StandardCharsets.UTF_8).contains("sec-intro"));
        assertEquals(0, captured.size());
    }

    @Test
    void writesBiblioFileWhenConfigured() throws IOException {
        Path biblioFile = workDir.resolve("biblio/spec.json");
        properties.getOutput().setBiblioFile(biblioFile.toString());

        command.run(new DefaultApplicationArguments(input().toString(), workDir.resolve("index.html").toString()));

        JsonNode exported = new ObjectMapper().readTree(biblioFile.toFile());
        assertTrue(exported.has(LOCATION));
        assertFalse(exported.get(LOCATION).isEmpty());
    }

    @Test
    void reportsUsageWithoutInput() {
        command.run(new DefaultApplicationArguments("--specweave.location=x"));

        assertEquals(CompileCommand.EXIT_USAGE, command.getExitCode());
    }

    @Test
    void reportsUsageWithTooManyArguments() {
        command.run(new DefaultApplicationArguments("a.html", "b.html", "c.html"));

        assertEquals(CompileCommand.EXIT_USAGE, command.getExitCode());
    }

    @Test
    void failsOnMissingInput() {
        command.run(new DefaultApplicationArguments(workDir.resolve("absent.html").toString()));

        assertEquals(CompileCommand.EXIT_FAILED, command.getExitCode());
    }

    @Test
    void failsOnFatalCompilationError() throws IOException {
        Path file = workDir.resolve("broken.html");
        Files.writeString(file, "<emu-import href=\"missing.html\"></emu-import>", StandardCharsets.UTF_8);

        command.run(new DefaultApplicationArguments(file.toString()));

        assertEquals(CompileCommand.EXIT_FAILED, command.getExitCode());
    }
}
