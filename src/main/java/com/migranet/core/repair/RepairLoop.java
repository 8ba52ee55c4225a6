package com.migranet.core.repair;

import com.migranet.config.MigrationSettings;
import com.migranet.core.classifier.DeploymentErrorKind;
import com.migranet.core.classifier.ErrorClassifier;
import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.GuardedTranslator;
import com.migranet.core.conversion.TranslationRequest;
import com.migranet.core.conversion.TranslationRequest.SectionType;
import com.migranet.core.executor.ExternalCallGuard;
import com.migranet.core.memory.ErrorSolution;
import com.migranet.core.memory.MemoryStore;
import com.migranet.core.memory.MigrationPattern;
import com.migranet.core.memory.SolutionSource;
import com.migranet.core.model.MigrationObject;
import com.migranet.core.model.MigrationStatus;
import com.migranet.core.search.SearchHit;
import com.migranet.core.search.WebSearchClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * RepairLoop: bounded deploy → classify → fix → redeploy cycle for one object.
 *
 * Per attempt:
 *   1. deploy current text (timeout = failure of kind TIMEOUT, consumes the attempt)
 *   2. success → stop
 *   3. failure → REPAIRING, classify, signature, memory lookup;
 *      web search only when memory has nothing AND the signature has not been
 *      searched for this object yet
 *   4. not the last attempt → ask the translator for patched text;
 *      translator failure stops the loop
 *
 * The loop never moves the object to a terminal status; the orchestrator does.
 * An interrupted deploy (MigrationCancelledException) propagates and the
 * in-flight attempt is not recorded.
 */
@Component
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    static final int SUMMARY_EXCERPT_CHARS = 300;

    private final ErrorClassifier   classifier;
    private final WebSearchClient   searchClient;
    private final GuardedTranslator translator;
    private final ExternalCallGuard callGuard;
    private final MigrationSettings settings;

    public RepairLoop(
            ErrorClassifier classifier,
            WebSearchClient searchClient,
            GuardedTranslator translator,
            ExternalCallGuard callGuard,
            MigrationSettings settings
    ) {
        this.classifier   = classifier;
        this.searchClient = searchClient;
        this.translator   = translator;
        this.callGuard    = callGuard;
        this.settings     = settings;
    }

    public RepairOutcome repair(MigrationObject object, String convertedText,
                                DeploymentExecutor deployer, MemoryStore store) {

        final String label      = object.getQualifiedName();
        final int    maxAttempts = settings.getMaxAttempts();

        List<DeploymentAttempt> attempts = new ArrayList<>();
        Set<String> searchedSignatures   = new HashSet<>();
        String text                      = convertedText;
        PendingFix pendingFix            = null;

        object.setTargetDefinition(text);

        for (int index = 1; index <= maxAttempts; index++) {

            log.info("[RepairLoop] {} deploy attempt {}/{}", label, index, maxAttempts);
            DeployResult result = deploy(label, index, text, deployer);

            // ----------------------------------------------------------------
            // Success
            // ----------------------------------------------------------------
            if (result.isSuccess()) {
                attempts.add(DeploymentAttempt.builder(index)
                        .outcome(DeploymentAttempt.Outcome.SUCCESS)
                        .build());

                store.appendPattern(MigrationPattern.success(object.getKind(), object.getName(),
                        successSummary(index, pendingFix, text)));

                if (pendingFix != null && pendingFix.memoryHits == 0) {
                    store.appendSolution(ErrorSolution.of(pendingFix.signature, text, pendingFix.provenance));
                    log.info("[RepairLoop] {} learned new solution for {}", label, pendingFix.signature);
                }

                log.info("[RepairLoop] {} deployed on attempt {}", label, index);
                return new RepairOutcome(MigrationStatus.DEPLOYED, attempts, text, false);
            }

            // ----------------------------------------------------------------
            // Failure: classify, consult memory, maybe search
            // ----------------------------------------------------------------
            if (object.getStatus() != MigrationStatus.REPAIRING) {
                object.transitionTo(MigrationStatus.REPAIRING);
            }

            String rawError = result.getRawError();
            DeploymentErrorKind kind = result.isTimedOut()
                    ? DeploymentErrorKind.TIMEOUT
                    : classifier.classify(rawError);
            String signature = classifier.signature(object.getKind(), kind, rawError);

            List<ErrorSolution> memoryHits = store.getSolutions(signature, settings.getMemorySolutionLimit());
            List<SearchHit> searchHits = List.of();
            if (memoryHits.isEmpty() && searchedSignatures.add(signature)) {
                searchHits = search(label, classifier.normalize(rawError), object);
            }

            log.warn("[RepairLoop] {} attempt {} failed [{}] memoryHits={} searchHits={}",
                    label, index, kind.getCode(), memoryHits.size(), searchHits.size());

            DeploymentAttempt.Builder attempt = DeploymentAttempt.builder(index)
                    .outcome(DeploymentAttempt.Outcome.FAILED)
                    .rawError(rawError)
                    .errorKind(kind)
                    .signature(signature)
                    .memoryHits(memoryHits.size())
                    .searchHits(searchHits.size());

            if (index == maxAttempts) {
                attempts.add(attempt.build());
                break;
            }

            // ----------------------------------------------------------------
            // Fix
            // ----------------------------------------------------------------
            String fixed;
            try {
                fixed = translator.translate(
                        buildRepairRequest(object, text, rawError, kind, memoryHits, searchHits, store));
            } catch (ConversionException e) {
                log.error("[RepairLoop] {} translator could not produce a fix: {}", label, e.getMessage());
                attempts.add(attempt.build());
                break;
            }

            SolutionSource provenance = !memoryHits.isEmpty() ? SolutionSource.MEMORY
                    : !searchHits.isEmpty() ? SolutionSource.WEB_SEARCH
                    : SolutionSource.TRANSLATOR;

            attempts.add(attempt.fix(fixed, provenance).build());
            pendingFix = new PendingFix(signature, provenance, memoryHits.size());
            text = fixed;
            object.setTargetDefinition(text);
        }

        store.appendPattern(MigrationPattern.failure(object.getKind(), object.getName(),
                failureSummary(attempts)));

        log.error("[RepairLoop] {} not deployed after {} attempt(s)", label, attempts.size());
        return new RepairOutcome(MigrationStatus.UNRESOLVED, attempts, text, true);
    }

    // =========================================================================
    // Collaborator calls
    // =========================================================================

    private DeployResult deploy(String label, int index, String text, DeploymentExecutor deployer) {
        try {
            DeployResult result = callGuard.call("deploy " + label + " #" + index,
                    settings.getDeploymentTimeout(), () -> deployer.deploy(text));
            return result != null ? result : DeployResult.failed("Deployment returned no result");

        } catch (TimeoutException e) {
            return DeployResult.timedOut("Deployment timed out after "
                    + settings.getDeploymentTimeout().toSeconds() + " seconds");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeployResult.failed(cause.getMessage() != null ? cause.getMessage() : cause.toString());
        }
    }

    private List<SearchHit> search(String label, String normalizedError, MigrationObject object) {
        try {
            List<SearchHit> hits = callGuard.call("search " + label, settings.getSearchTimeout(),
                    () -> searchClient.search(normalizedError, object.getKind(), settings.getSearchMaxResults()));
            return hits != null ? hits : List.of();

        } catch (TimeoutException | ExecutionException e) {
            log.warn("[RepairLoop] {} web search unavailable: {}", label, e.getMessage());
            return List.of();
        }
    }

    // =========================================================================
    // Repair request
    // =========================================================================

    private TranslationRequest buildRepairRequest(MigrationObject object, String currentText, String rawError,
                                                  DeploymentErrorKind kind, List<ErrorSolution> memoryHits,
                                                  List<SearchHit> searchHits, MemoryStore store) {

        SectionType codeType = object.getKind().isStructural() ? SectionType.DDL : SectionType.CODE;

        TranslationRequest.Builder builder = TranslationRequest.builder(object.getName(), object.getKind())
                .repair(true)
                .section(codeType, "Original source", object.getSourceDefinition())
                .section(codeType, "Failing target text", currentText)
                .section(SectionType.ERROR, "Deployment error (" + kind.getCode() + ")", rawError);

        List<String> identity = store.getIdentityColumns(object.getName());
        if (!identity.isEmpty()) {
            builder.section(SectionType.METADATA, "Known identity columns", String.join(", ", identity));
        }

        for (ErrorSolution hit : memoryHits) {
            builder.section(SectionType.PATTERN, "Fix that worked before (" + hit.getProvenance().getCode() + ")",
                    hit.getSolutionText());
        }
        for (SearchHit hit : searchHits) {
            builder.section(SectionType.SEARCH, hit.getTitle() + " " + hit.getUrl(), hit.getSnippet());
        }
        return builder.build();
    }

    private static String successSummary(int index, PendingFix fix, String text) {
        String how = fix == null ? "as converted" : "after " + fix.provenance.getCode() + " fix";
        return "Deployed on attempt " + index + " " + how + ": " + excerpt(text);
    }

    private static String failureSummary(List<DeploymentAttempt> attempts) {
        if (attempts.isEmpty()) return "No deployment attempted";
        DeploymentAttempt last = attempts.get(attempts.size() - 1);
        return "Unresolved after " + attempts.size() + " attempt(s), last error ["
                + last.getErrorKind().getCode() + "] " + excerpt(last.getRawError());
    }

    private static String excerpt(String text) {
        if (text == null) return "";
        String flat = text.strip();
        return flat.length() > SUMMARY_EXCERPT_CHARS ? flat.substring(0, SUMMARY_EXCERPT_CHARS) : flat;
    }

    private static final class PendingFix {
        final String         signature;
        final SolutionSource provenance;
        final int            memoryHits;

        PendingFix(String signature, SolutionSource provenance, int memoryHits) {
            this.signature  = signature;
            this.provenance = provenance;
            this.memoryHits = memoryHits;
        }
    }
}
