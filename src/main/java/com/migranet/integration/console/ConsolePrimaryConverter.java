package com.migranet.integration.console;

import com.migranet.config.MigrationSettings;
import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.PrimaryConverter;
import com.migranet.core.model.ObjectKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * PrimaryConverter backed by an external console conversion tool.
 *
 * The configured command line may use {input}, {output} and {kind} placeholders.
 * The source is written to {input}; the tool writes T-SQL to {output} and its
 * diagnostics (ERROR:/WARNING: lines) to stdout/stderr, which are merged.
 *
 * With no command configured the converter reports itself unavailable and the
 * router goes straight to the fallback translator.
 */
@Component
public class ConsolePrimaryConverter implements PrimaryConverter {

    private static final Logger log = LoggerFactory.getLogger(ConsolePrimaryConverter.class);

    private final List<String> commandTemplate;
    private final Duration     timeout;

    @Autowired
    public ConsolePrimaryConverter(
            @Value("${migranet.conversion.primary-command:}") String command,
            MigrationSettings settings
    ) {
        this(command, settings.getConversionTimeout());
    }

    ConsolePrimaryConverter(String command, Duration timeout) {
        this.commandTemplate = command == null || command.isBlank()
                ? List.of()
                : List.of(command.trim().split("\\s+"));
        this.timeout = timeout;

        if (commandTemplate.isEmpty()) {
            log.info("[ConsoleConverter] No primary command configured, primary conversion disabled");
        } else {
            log.info("[ConsoleConverter] Command: {}", String.join(" ", commandTemplate));
        }
    }

    @Override
    public boolean isAvailable() {
        return !commandTemplate.isEmpty();
    }

    @Override
    public PrimaryOutput convert(String sourceText, ObjectKind kind) throws ConversionException {
        if (!isAvailable()) {
            throw new ConversionException("No primary converter command configured");
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("migranet_convert_");
            Path input  = workDir.resolve("input.sql");
            Path output = workDir.resolve("output.sql");
            Files.writeString(input, sourceText, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            for (String part : commandTemplate) {
                command.add(part
                        .replace("{input}", input.toString())
                        .replace("{output}", output.toString())
                        .replace("{kind}", kind.name()));
            }
            return run(command, workDir, output);

        } catch (IOException e) {
            throw new ConversionException("Primary converter I/O failed: " + e.getMessage(), e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private PrimaryOutput run(List<String> command, Path workDir, Path output)
            throws IOException, ConversionException {

        log.debug("[ConsoleConverter] Executing: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workDir.toFile());
        builder.redirectErrorStream(true);

        Process process = builder.start();
        StringBuilder diagnostics = new StringBuilder();

        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    synchronized (diagnostics) {
                        diagnostics.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.warn("[ConsoleConverter] Error reading output: {}", e.getMessage());
            }
        }, "migranet-converter-output");
        reader.setDaemon(true);
        reader.start();

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ConversionException("Primary converter timed out after " + timeout.toSeconds() + "s");
            }
            reader.join(1000);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConversionException("Primary converter interrupted", e);
        }

        int exitCode = process.exitValue();
        String converted = Files.exists(output) ? Files.readString(output, StandardCharsets.UTF_8) : "";
        String toolOutput;
        synchronized (diagnostics) {
            toolOutput = diagnostics.toString();
        }
        log.info("[ConsoleConverter] Exit code: {}, output {} chars", exitCode, converted.length());
        return new PrimaryOutput(converted, toolOutput, exitCode);
    }

    private void deleteRecursively(Path dir) {
        if (dir == null) return;
        try (var paths = Files.walk(dir)) {
            paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("[ConsoleConverter] Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("[ConsoleConverter] Could not clean {}: {}", dir, e.getMessage());
        }
    }
}
