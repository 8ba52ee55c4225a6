package com.migranet.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.model.MigrationObject;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.source.ConnectivityException;
import com.migranet.orchestrator.MigrationOrchestrator;
import com.migranet.orchestrator.MigrationSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/migration")
public class MigrationController {

    private static final Logger log = LoggerFactory.getLogger(MigrationController.class);

    private final MigrationOrchestrator orchestrator;

    public MigrationController(MigrationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/run")
    public ResponseEntity<MigrationSummary> run(@RequestBody RunRequest request) {

        if (request == null || request.objects == null || request.objects.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        List<MigrationObject> objects = new ArrayList<>();
        for (ObjectRequest o : request.objects) {
            try {
                objects.add(o.toMigrationObject());
            } catch (IllegalArgumentException e) {
                log.warn("[Controller] Rejected object {}: {}", o.name, e.getMessage());
                return ResponseEntity.badRequest().build();
            }
        }

        return ResponseEntity.ok(orchestrator.runBatch(objects));
    }

    @GetMapping("/memory")
    public ResponseEntity<Map<String, Integer>> memory() {
        return ResponseEntity.ok(orchestrator.getMemoryStore().statistics());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel() {
        orchestrator.cancel();
        return ResponseEntity.accepted().build();
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<Map<String, String>> onConnectivity(ConnectivityException e) {
        log.error("[Controller] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    // =========================================================================
    // Request bodies
    // =========================================================================

    public static class RunRequest {
        @JsonProperty("objects")
        public List<ObjectRequest> objects;
    }

    public static class ObjectRequest {
        @JsonProperty("name")           public String name;
        @JsonProperty("schema")         public String schema;
        @JsonProperty("kind")           public String kind;
        @JsonProperty("parent_package") public String parentPackage;
        @JsonProperty("source_text")    public String sourceText;

        MigrationObject toMigrationObject() {
            if (kind == null) {
                throw new IllegalArgumentException("kind is required");
            }
            ObjectKind objectKind = ObjectKind.valueOf(kind.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            MigrationObject object = objectKind == ObjectKind.PACKAGE_MEMBER
                    ? MigrationObject.packageMember(schema, parentPackage, name)
                    : MigrationObject.of(schema, name, objectKind);
            if (sourceText != null && !sourceText.isBlank()) {
                object.setSourceDefinition(sourceText);
            }
            return object;
        }
    }
}
