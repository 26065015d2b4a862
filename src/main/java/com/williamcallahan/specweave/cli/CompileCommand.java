package com.williamcallahan.specweave.cli;

import com.williamcallahan.specweave.config.CompilerProperties;
import com.williamcallahan.specweave.domain.CompilationResult;
import com.williamcallahan.specweave.service.SpecCompilationException;
import com.williamcallahan.specweave.service.SpecCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry: {@code specweave <input.html> [output.html]}.
 *
 * <p>Compiler settings are passed as {@code --specweave.*} options. The rendered document goes to
 * stdout when no output path is given.</p>
 */
@Component
public class CompileCommand implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final SpecCompiler compiler;
    private final CompilerProperties properties;
    private final PrintStream stdout;
    private int exitCode = EXIT_OK;

    @Autowired
    public CompileCommand(SpecCompiler compiler, CompilerProperties properties) {
        this(compiler, properties, System.out);
    }

    CompileCommand(SpecCompiler compiler, CompilerProperties properties, PrintStream stdout) {
        this.compiler = compiler;
        this.properties = properties;
        this.stdout = stdout;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty() || files.size() > 2) {
            log.error("Usage: specweave <input.html> [output.html] [--specweave.location=<url>]");
            exitCode = EXIT_USAGE;
            return;
        }
        Path input = Path.of(files.get(0)).toAbsolutePath();
        Path output = files.size() == 2 ? Path.of(files.get(1)).toAbsolutePath() : null;
        try {
            String source = Files.readString(input, StandardCharsets.UTF_8);
            CompilationResult result = compiler.compile(source, input);
            if (result.hasDiagnostics()) {
                log.warn("Compiled {} with {} diagnostics", input, result.diagnostics().size());
            }
            writeOutput(result, output);
            exitCode = EXIT_OK;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", input, e.getMessage());
            exitCode = EXIT_FAILED;
        } catch (SpecCompilationException | UncheckedIOException e) {
            log.error("Compilation of {} failed: {}", input, e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    private void writeOutput(CompilationResult result, Path output) {
        try {
            if (output == null) {
                stdout.print(result.html());
                stdout.flush();
            } else {
                createParent(output);
                Files.writeString(output, result.html(), StandardCharsets.UTF_8);
                log.info("Wrote {}", output);
            }
            if (properties.getOutput().hasBiblioFile() && result.biblioJson() != null) {
                Path biblioFile = Path.of(properties.getOutput().getBiblioFile()).toAbsolutePath();
                createParent(biblioFile);
                Files.writeString(biblioFile, result.biblioJson(), StandardCharsets.UTF_8);
                log.info("Wrote bibliography to {}", biblioFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write compilation output", e);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
