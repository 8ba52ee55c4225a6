package com.migranet.orchestrator;

import com.migranet.communication.EventBus;
import com.migranet.config.MigrationSettings;
import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.ConversionResult;
import com.migranet.core.conversion.ConversionRouter;
import com.migranet.core.conversion.ConversionTool;
import com.migranet.core.conversion.SchemaReferenceRewriter;
import com.migranet.core.event.MigrationEvent;
import com.migranet.core.event.MigrationEventType;
import com.migranet.core.executor.ExternalCallGuard;
import com.migranet.core.executor.MigrationCancelledException;
import com.migranet.core.memory.MemoryStore;
import com.migranet.core.memory.MigrationPattern;
import com.migranet.core.memory.ObjectDescription;
import com.migranet.core.memory.PersistenceException;
import com.migranet.core.memory.SharedMemoryStore;
import com.migranet.core.memory.TableMapping;
import com.migranet.core.metadata.MetadataRefresher;
import com.migranet.core.model.MigrationObject;
import com.migranet.core.model.MigrationStatus;
import com.migranet.core.repair.DeploymentAttempt;
import com.migranet.core.repair.DeploymentExecutor;
import com.migranet.core.repair.RepairLoop;
import com.migranet.core.repair.RepairOutcome;
import com.migranet.core.review.CodeReviewer;
import com.migranet.core.review.ReviewFinding;
import com.migranet.core.source.ConnectivityException;
import com.migranet.core.source.SourceCatalog;
import com.migranet.core.usage.UsageTracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * MigrationOrchestrator: per-object workflow and batch driver.
 *
 * Per object (run):
 *   NEW → fetch → FETCHED → convert + schema rewrite → CONVERTED → review → REVIEWED
 *       → RepairLoop → DEPLOYED   (metadata refresh merged into memory)
 *                    → UNRESOLVED (report written, failure pattern recorded)
 *
 * A fetch or conversion failure drops straight to UNRESOLVED with zero attempts.
 * Per-object failures never escape run(); only cancellation does.
 *
 * Batch (runBatch): connectivity check on both ends, target schema ensured,
 * then objects strictly in order, memory flushed every flush-every objects and
 * always once at the end.
 */
@Component
public class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    private static final String SOURCE = "MigrationOrchestrator";

    static final int CONTEXT_PATTERN_LIMIT = 3;

    private final SourceCatalog           sourceCatalog;
    private final ConversionRouter        conversionRouter;
    private final SchemaReferenceRewriter schemaRewriter;
    private final CodeReviewer            reviewer;
    private final RepairLoop              repairLoop;
    private final DeploymentExecutor      deployer;
    private final MetadataRefresher       metadataRefresher;
    private final SharedMemoryStore       memoryLifecycle;
    private final MemoryStore             memory;
    private final UnresolvedReportWriter  reportWriter;
    private final EventBus                eventBus;
    private final ExternalCallGuard       callGuard;
    private final UsageTracker            usageTracker;
    private final MigrationSettings       settings;

    private volatile boolean cancelRequested = false;

    public MigrationOrchestrator(
            SourceCatalog sourceCatalog,
            ConversionRouter conversionRouter,
            SchemaReferenceRewriter schemaRewriter,
            CodeReviewer reviewer,
            RepairLoop repairLoop,
            DeploymentExecutor deployer,
            MetadataRefresher metadataRefresher,
            SharedMemoryStore memoryLifecycle,
            MemoryStore memory,
            UnresolvedReportWriter reportWriter,
            EventBus eventBus,
            ExternalCallGuard callGuard,
            UsageTracker usageTracker,
            MigrationSettings settings
    ) {
        this.sourceCatalog     = sourceCatalog;
        this.conversionRouter  = conversionRouter;
        this.schemaRewriter    = schemaRewriter;
        this.reviewer          = reviewer;
        this.repairLoop        = repairLoop;
        this.deployer          = deployer;
        this.metadataRefresher = metadataRefresher;
        this.memoryLifecycle   = memoryLifecycle;
        this.memory            = memory;
        this.reportWriter      = reportWriter;
        this.eventBus          = eventBus;
        this.callGuard         = callGuard;
        this.usageTracker      = usageTracker;
        this.settings          = settings;
    }

    public MemoryStore getMemoryStore() {
        return memory;
    }

    /** Stop the running batch before its next object. */
    public void cancel() {
        log.warn("[Orchestrator] Cancellation requested");
        cancelRequested = true;
    }

    // =========================================================================
    // Batch
    // =========================================================================

    public synchronized MigrationSummary runBatch(List<MigrationObject> objects) {
        cancelRequested = false;

        ping("source", sourceCatalog::ping);
        ping("target", deployer::ping);
        usageTracker.reset();

        log.info("[Orchestrator] Batch of {} object(s) started", objects.size());
        publish(MigrationEventType.BATCH_STARTED, objects.size() + " object(s)");

        MigrationSummary summary = new MigrationSummary();
        int sinceFlush = 0;
        boolean interrupted = false;

        try {
            try {
                ensureTargetSchema();
            } catch (MigrationCancelledException e) {
                interrupted = Thread.interrupted();
                cancelRequested = true;
                summary.markCancelled();
            }

            for (int i = 0; i < objects.size(); i++) {
                int remaining = objects.size() - i;

                if (cancelRequested) {
                    summary.addSkipped(remaining);
                    summary.markCancelled();
                    break;
                }

                try {
                    summary.record(run(objects.get(i), memory));
                } catch (MigrationCancelledException e) {
                    // clear the flag so the final flush is not interrupted; restored below
                    interrupted = Thread.interrupted();
                    log.warn("[Orchestrator] {} interrupted mid-call, attempt discarded",
                            objects.get(i).getQualifiedName());
                    summary.addSkipped(remaining);
                    summary.markCancelled();
                    break;
                }

                if (++sinceFlush >= settings.getFlushEvery()) {
                    memoryLifecycle.persist(memory);
                    sinceFlush = 0;
                }
            }
        } finally {
            memoryLifecycle.persist(memory);
        }

        summary.setLlmUsage(usageTracker.snapshot());

        if (summary.isCancelled()) {
            publish(MigrationEventType.BATCH_CANCELLED, summary.getSkipped() + " object(s) skipped");
        } else {
            publish(MigrationEventType.BATCH_COMPLETED,
                    summary.getTotalMigrated() + " migrated, " + summary.getTotalFailed() + " failed");
        }
        log.info("[Orchestrator] {}", summary.render());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    /**
     * Create the configured target schema once; remembered in memory so later
     * batches skip the round trip. Failure is logged; deploys then report the
     * missing schema per object.
     */
    private void ensureTargetSchema() {
        String schema = settings.getTargetSchema();
        if (memory.isSchemaPresent(schema)) {
            return;
        }
        try {
            boolean created = guarded("schema " + schema, () -> deployer.ensureSchema(schema));
            memory.markSchemaPresent(schema);
            log.info("[Orchestrator] Target schema [{}] {}", schema, created ? "created" : "already present");
        } catch (TimeoutException | ExecutionException e) {
            log.error("[Orchestrator] Target schema [{}] could not be ensured: {}", schema, rootMessage(e));
        }
    }

    private void ping(String side, Runnable check) {
        try {
            callGuard.call("ping " + side, settings.getMetadataTimeout(), () -> {
                check.run();
                return Boolean.TRUE;
            });
        } catch (TimeoutException e) {
            throw new ConnectivityException("The " + side + " database did not answer within "
                    + settings.getMetadataTimeout().toSeconds() + " seconds", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConnectivityException) {
                throw (ConnectivityException) cause;
            }
            throw new ConnectivityException("The " + side + " database is unreachable: " + cause.getMessage(), cause);
        }
    }

    // =========================================================================
    // Single object
    // =========================================================================

    public ObjectMigrationResult run(MigrationObject object, MemoryStore store) {
        String label = object.getQualifiedName();
        log.info("[Orchestrator] ===== {} {} =====", object.getKind().getLabel(), label);
        publish(MigrationEventType.OBJECT_STARTED, object.getKind().getLabel() + " " + label);

        // ---------------------------------------------------------------- fetch
        if (!object.hasSourceDefinition()) {
            String fetched;
            try {
                fetched = guarded("fetch " + label, () -> sourceCatalog.fetchDefinition(object));
            } catch (TimeoutException | ExecutionException e) {
                return unresolved(object, store, "Source definition could not be fetched: " + rootMessage(e),
                        List.of(), null, null, List.of(), false);
            }
            if (fetched == null || fetched.isBlank()) {
                return unresolved(object, store, "Source definition is empty",
                        List.of(), null, null, List.of(), false);
            }
            object.setSourceDefinition(fetched);
        }
        move(object, MigrationStatus.FETCHED);

        // -------------------------------------------------------------- convert
        ConversionResult conversion;
        try {
            conversion = conversionRouter.convert(object, store);
        } catch (ConversionException e) {
            log.error("[Orchestrator] {} conversion failed: {}", label, e.getMessage());
            return unresolved(object, store, "Conversion failed: " + e.getMessage(),
                    List.of(), null, null, List.of(), false);
        }
        String targetText = schemaRewriter.rewrite(conversion.getText(), object.getSchema());
        object.setTargetDefinition(targetText);
        move(object, MigrationStatus.CONVERTED);

        // --------------------------------------------------------------- review
        List<ReviewFinding> findings = List.of();
        if (settings.isReviewEnabled()) {
            findings = reviewer.review(object.getSourceDefinition(), targetText, object.getKind());
            for (ReviewFinding finding : findings) {
                log.warn("[Orchestrator] {} review: {}", label, finding);
            }
        }
        move(object, MigrationStatus.REVIEWED);

        // -------------------------------------------------------- deploy/repair
        RepairOutcome outcome = repairLoop.repair(object, targetText, deployer, store);
        if (object.getStatus() == MigrationStatus.REPAIRING) {
            publish(MigrationEventType.STATUS_CHANGED, label + " REVIEWED → REPAIRING");
        }

        if (outcome.isDeployed()) {
            move(object, MigrationStatus.DEPLOYED);
            refreshMetadata(object, store);
            publish(MigrationEventType.OBJECT_DEPLOYED, label + " after " + outcome.getAttempts().size() + " attempt(s)");
            return new ObjectMigrationResult(object.getName(), object.getQualifiedName(), object.getKind(),
                    MigrationStatus.DEPLOYED, outcome.getAttempts(), conversion.getTool(), findings, null);
        }

        String reason = outcome.getAttempts().size() < settings.getMaxAttempts()
                ? "Repair stopped after " + outcome.getAttempts().size() + " attempt(s): no fix could be produced"
                : "Max repair attempts exceeded without success";
        return unresolved(object, store, reason,
                outcome.getAttempts(), outcome.getFinalText(), conversion.getTool(), findings,
                outcome.isFailurePatternRecorded());
    }

    // =========================================================================
    // Terminal handling
    // =========================================================================

    private ObjectMigrationResult unresolved(MigrationObject object, MemoryStore store, String reason,
                                             List<DeploymentAttempt> attempts, String finalText,
                                             ConversionTool tool, List<ReviewFinding> findings,
                                             boolean failurePatternRecorded) {
        move(object, MigrationStatus.UNRESOLVED);

        String finalError = attempts.isEmpty() ? reason : attempts.get(attempts.size() - 1).getRawError();
        if (!failurePatternRecorded) {
            store.appendPattern(MigrationPattern.failure(object.getKind(), object.getName(), reason));
        }

        String reportId = reportWriter.allocateReportId(object.getName());
        UnresolvedReport report = UnresolvedReport.builder(reportId)
                .object(object.getName(), object.getSchema(), object.getParentPackage(), object.getKind())
                .reason(reason)
                .attempts(attempts)
                .finalError(finalError)
                .finalAttemptedText(finalText != null ? finalText : object.getTargetDefinition())
                .sourceText(object.getSourceDefinition())
                .memoryContext(memoryContext(object, store, attempts))
                .build();
        try {
            reportWriter.write(report);
        } catch (PersistenceException e) {
            log.error("[Orchestrator] {} unresolved report not written: {}", object.getQualifiedName(), e.getMessage());
            reportId = null;
        }

        publish(MigrationEventType.OBJECT_UNRESOLVED, object.getQualifiedName() + ": " + reason
                + (reportId != null ? " (report " + reportId + ")" : ""));

        return new ObjectMigrationResult(object.getName(), object.getQualifiedName(), object.getKind(),
                MigrationStatus.UNRESOLVED, attempts, tool, findings, reportId);
    }

    private Map<String, Object> memoryContext(MigrationObject object, MemoryStore store,
                                              List<DeploymentAttempt> attempts) {
        String lastSignature = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getSignature();

        List<String> similar = store.recentPatterns(object.getKind(), null, CONTEXT_PATTERN_LIMIT).stream()
                .map(p -> p.getObjectName() + " (" + p.getOutcome() + ")")
                .collect(Collectors.toList());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("identity_columns", store.getIdentityColumns(object.getName()));
        context.put("similar_patterns", similar);
        context.put("last_signature", lastSignature != null ? lastSignature : "");
        context.put("error_solutions_available", lastSignature != null ? store.countSolutions(lastSignature) : 0);
        return context;
    }

    private void refreshMetadata(MigrationObject object, MemoryStore store) {
        String label = object.getQualifiedName();
        try {
            ObjectDescription description = guarded("metadata " + label,
                    () -> metadataRefresher.describe(object, settings.getTargetSchema()));
            if (description == null) {
                log.warn("[Orchestrator] {} metadata refresh returned nothing", label);
                return;
            }
            store.upsertSchema(object.getName(), description);

            if (object.getKind().isStructural()) {
                store.upsertIdentityColumns(object.getName(), description.getIdentityColumns());
                String schema = description.getSchema() != null ? description.getSchema() : settings.getTargetSchema();
                store.upsertTableMapping(object.getName(),
                        new TableMapping(object.getName(), schema, description.getName()));
            }
            log.info("[Orchestrator] {} metadata merged ({} column(s))", label, description.getColumns().size());

        } catch (TimeoutException | ExecutionException e) {
            log.warn("[Orchestrator] {} metadata refresh failed: {}", label, rootMessage(e));
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> T guarded(String label, Callable<T> call) throws TimeoutException, ExecutionException {
        return callGuard.call(label, settings.getMetadataTimeout(), call);
    }

    private void move(MigrationObject object, MigrationStatus next) {
        MigrationStatus previous = object.getStatus();
        object.transitionTo(next);
        publish(MigrationEventType.STATUS_CHANGED, object.getQualifiedName() + " " + previous + " → " + next);
    }

    private void publish(MigrationEventType type, Object payload) {
        eventBus.publish(new MigrationEvent(type, SOURCE, payload));
    }

    private static String rootMessage(Throwable t) {
        if (t instanceof TimeoutException) {
            return "timed out";
        }
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
