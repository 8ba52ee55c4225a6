package com.migranet.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.migranet.config.JsonMappers;
import com.migranet.config.MigrationSettings;
import com.migranet.core.memory.PersistenceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes one JSON document per unresolved object: {dir}/{NAME}_{yyyyMMdd_HHmmss}.json.
 * The file base name is the report id.
 */
@Component
public class UnresolvedReportWriter {

    private static final Logger log = LoggerFactory.getLogger(UnresolvedReportWriter.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path         directory;
    private final Clock        clock;
    private final ObjectMapper mapper = JsonMappers.documentMapper();

    @Autowired
    public UnresolvedReportWriter(MigrationSettings settings) {
        this(settings.getUnresolvedDir(), Clock.systemDefaultZone());
    }

    UnresolvedReportWriter(Path directory, Clock clock) {
        this.directory = directory.toAbsolutePath().normalize();
        this.clock     = clock;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Report id for the object, unique within the directory. Same-second collisions
     * get a _2, _3 ... suffix.
     */
    public synchronized String allocateReportId(String objectName) {
        String base = sanitize(objectName) + "_" + LocalDateTime.now(clock).format(STAMP);
        String id = base;
        for (int n = 2; Files.exists(pathFor(id)); n++) {
            id = base + "_" + n;
        }
        return id;
    }

    public Path write(UnresolvedReport report) throws PersistenceException {
        Path target = pathFor(report.getReportId());
        try {
            Files.createDirectories(directory);
            Files.writeString(target, mapper.writeValueAsString(report), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.error("[Unresolved] {} logged to {}", report.getObjectName(), target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write unresolved report " + target, e);
        }
    }

    Path pathFor(String reportId) {
        return directory.resolve(reportId + ".json");
    }

    private static String sanitize(String name) {
        String cleaned = name == null ? "" : name.trim().replaceAll("[^A-Za-z0-9_$#.-]", "_");
        return cleaned.isEmpty() ? "OBJECT" : cleaned;
    }
}
