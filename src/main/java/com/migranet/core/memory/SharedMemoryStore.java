package com.migranet.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.migranet.config.JsonMappers;
import com.migranet.config.MigrationSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * SharedMemoryStore: load/persist lifecycle of the MemoryStore document.
 *
 * load():    missing, empty, malformed or wrong-shape file → empty store (logged).
 * persist(): temp file in the same directory, then ATOMIC_MOVE over the target,
 *            so a crash never leaves a half-written document behind.
 *
 * The first persistence failure switches the component to in-memory-only mode;
 * every later persist is skipped for the rest of the process.
 */
@Component
public class SharedMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SharedMemoryStore.class);

    private final Path         path;
    private final ObjectMapper mapper = JsonMappers.documentMapper();

    private volatile boolean inMemoryOnly = false;

    @Autowired
    public SharedMemoryStore(MigrationSettings settings) {
        this(settings.getMemoryPath());
    }

    public SharedMemoryStore(Path path) {
        this.path = path.toAbsolutePath().normalize();
        log.info("[Memory] Store file: {}", this.path);
    }

    public Path getPath() {
        return path;
    }

    public boolean isInMemoryOnly() {
        return inMemoryOnly;
    }

    // =========================================================================
    // Load
    // =========================================================================

    public MemoryStore load() {
        if (!Files.exists(path)) {
            log.info("[Memory] No store at {}, starting empty", path);
            return new MemoryStore();
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                log.warn("[Memory] Store file {} is empty, starting empty", path);
                return new MemoryStore();
            }
            MemoryStore store = mapper.readValue(json, MemoryStore.class);
            if (store == null) {
                log.warn("[Memory] Store file {} holds no document, starting empty", path);
                return new MemoryStore();
            }
            log.info("[Memory] Loaded {}", store.statistics());
            return store;

        } catch (IOException | RuntimeException e) {
            // Jackson reports wrong-shape sections as IOException subclasses; constructors may throw NPE/IAE
            log.warn("[Memory] Store file {} is unreadable ({}), starting empty", path, e.getMessage());
            return new MemoryStore();
        }
    }

    // =========================================================================
    // Persist
    // =========================================================================

    /**
     * Flush the whole document. Returns false when the flush was skipped or failed;
     * never throws.
     */
    public boolean persist(MemoryStore store) {
        if (inMemoryOnly) {
            log.debug("[Memory] In-memory-only mode, flush skipped");
            return false;
        }
        try {
            writeAtomically(store);
            log.debug("[Memory] Flushed {}", store.statistics());
            return true;
        } catch (PersistenceException e) {
            inMemoryOnly = true;
            log.error("[Memory] {}; continuing in-memory only, further flushes skipped", e.getMessage(), e);
            return false;
        }
    }

    private void writeAtomically(MemoryStore store) throws PersistenceException {
        Path dir = path.getParent();
        Path temp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            ObjectNode document = mapper.valueToTree(store);
            document.put("last_updated", Instant.now().toString());

            temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(temp, mapper.writeValueAsString(document), StandardCharsets.UTF_8);

            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Memory] Atomic move unsupported on this file system, using plain replace");
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Failed to persist memory store to " + path, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("[Memory] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
