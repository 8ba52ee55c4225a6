package com.migranet.core.repair;

import com.migranet.config.MigrationSettings;
import com.migranet.core.classifier.DeploymentErrorKind;
import com.migranet.core.classifier.ErrorClassifier;
import com.migranet.core.conversion.GuardedTranslator;
import com.migranet.core.conversion.TranslationRequest;
import com.migranet.core.executor.ExternalCallGuard;
import com.migranet.core.memory.ErrorSolution;
import com.migranet.core.memory.MemoryStore;
import com.migranet.core.memory.MigrationPattern;
import com.migranet.core.memory.SolutionSource;
import com.migranet.core.model.MigrationObject;
import com.migranet.core.model.MigrationStatus;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.search.SearchHit;
import com.migranet.testing.FakeDeploymentExecutor;
import com.migranet.testing.FakeFallbackTranslator;
import com.migranet.testing.FakeWebSearchClient;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairLoopTest {

    private static final String SOURCE = "CREATE TABLE HR.EMPLOYEES (EMP_ID NUMBER GENERATED ALWAYS AS IDENTITY)";
    private static final String CONVERTED = "CREATE TABLE [dbo].[EMPLOYEES] (EMP_ID INT IDENTITY(1,1))";

    private final ErrorClassifier classifier = new ErrorClassifier();

    private ExternalCallGuard      guard;
    private FakeFallbackTranslator translator;
    private FakeWebSearchClient    search;
    private MemoryStore            store;

    @BeforeEach
    void setUp() {
        guard      = new ExternalCallGuard();
        translator = new FakeFallbackTranslator();
        search     = new FakeWebSearchClient();
        store      = new MemoryStore();
    }

    @AfterEach
    void tearDown() {
        guard.shutdown();
    }

    private RepairLoop loop(MigrationSettings settings) {
        return new RepairLoop(classifier, search, new GuardedTranslator(translator, guard, settings), guard, settings);
    }

    private RepairLoop loop() {
        return loop(MigrationSettings.builder().build());
    }

    private static MigrationObject reviewedTable() {
        MigrationObject object = MigrationObject.withSource("HR", "EMPLOYEES", ObjectKind.TABLE, SOURCE);
        object.transitionTo(MigrationStatus.FETCHED);
        object.transitionTo(MigrationStatus.CONVERTED);
        object.transitionTo(MigrationStatus.REVIEWED);
        return object;
    }

    @Test
    void firstTrySuccessNeedsNoRepair() {
        MigrationObject object = reviewedTable();
        FakeDeploymentExecutor deployer = FakeDeploymentExecutor.alwaysSucceeding();

        RepairOutcome outcome = loop().repair(object, CONVERTED, deployer, store);

        assertTrue(outcome.isDeployed());
        assertEquals(1, outcome.getAttempts().size());
        assertNull(outcome.getLastError());
        assertEquals(0, translator.getCallCount());
        assertEquals(MigrationStatus.REVIEWED, object.getStatus(), "loop never sets terminal status");
        assertEquals(1, store.recentPatterns(ObjectKind.TABLE, MigrationPattern.Outcome.SUCCESS, 5).size());
        assertEquals(0, store.statistics().get("error_solutions"));
    }

    @Test
    void repairsThroughTwoDifferentFailures() {
        MigrationObject object = reviewedTable();
        FakeDeploymentExecutor deployer = new FakeDeploymentExecutor()
                .thenFail("ORA-identity-001: cannot insert into generated column")
                .thenFail("Incorrect syntax near 'X'.")
                .thenSucceed();

        RepairOutcome outcome = loop().repair(object, CONVERTED, deployer, store);

        assertEquals(MigrationStatus.DEPLOYED, outcome.getFinalStatus());
        List<DeploymentAttempt> attempts = outcome.getAttempts();
        assertEquals(3, attempts.size());
        assertEquals(DeploymentErrorKind.IDENTITY_COLUMN, attempts.get(0).getErrorKind());
        assertEquals(DeploymentErrorKind.SYNTAX, attempts.get(1).getErrorKind());
        assertTrue(attempts.get(2).isSuccess());

        assertEquals(2, translator.getCallCount());
        assertEquals(CONVERTED, deployer.getDeployedTexts().get(0));
        assertEquals(attempts.get(0).getFixApplied(), deployer.getDeployedTexts().get(1));
        assertEquals(attempts.get(1).getFixApplied(), deployer.getDeployedTexts().get(2));
        assertEquals(outcome.getFinalText(), object.getTargetDefinition());

        assertEquals(MigrationStatus.REPAIRING, object.getStatus());
        assertEquals(1, store.recentPatterns(ObjectKind.TABLE, MigrationPattern.Outcome.SUCCESS, 5).size());
        assertTrue(store.recentPatterns(ObjectKind.TABLE, MigrationPattern.Outcome.FAILURE, 5).isEmpty());
    }

    @Test
    void successfulFixIsLearnedUnderTheLastSignature() {
        MigrationObject object = reviewedTable();
        FakeDeploymentExecutor deployer = new FakeDeploymentExecutor()
                .thenFail("Incorrect syntax near 'X'.")
                .thenSucceed();

        RepairOutcome outcome = loop().repair(object, CONVERTED, deployer, store);

        String signature = outcome.getAttempts().get(0).getSignature();
        List<ErrorSolution> learned = store.getSolutions(signature, 5);
        assertEquals(1, learned.size());
        assertEquals(outcome.getFinalText(), learned.get(0).getSolutionText());
        assertEquals(SolutionSource.TRANSLATOR, learned.get(0).getProvenance());
    }

    @Test
    void exhaustsAttemptsWhenEveryDeployFails() {
        MigrationObject object = reviewedTable();
        FakeDeploymentExecutor deployer = FakeDeploymentExecutor.alwaysFailing("Invalid object name 'HR.DEPT'.");

        RepairOutcome outcome = loop().repair(object, CONVERTED, deployer, store);

        assertEquals(MigrationStatus.UNRESOLVED, outcome.getFinalStatus());
        assertTrue(outcome.isFailurePatternRecorded());
        assertEquals(3, outcome.getAttempts().size());
        assertEquals(3, deployer.getDeployCount());
        assertEquals(2, translator.getCallCount(), "no fix is requested after the last attempt");
        assertNull(outcome.getAttempts().get(2).getFixApplied());
        assertEquals("Invalid object name 'HR.DEPT'.", outcome.getLastError());
        assertEquals(1, store.recentPatterns(ObjectKind.TABLE, MigrationPattern.Outcome.FAILURE, 5).size());
        assertEquals(MigrationStatus.REPAIRING, object.getStatus());
    }

    @Test
    void searchesOncePerSignatureWithinAnObject() {
        search = new FakeWebSearchClient(List.of(new SearchHit("Fix", "https://example.org/a", "use dbo")));
        FakeDeploymentExecutor deployer = FakeDeploymentExecutor.alwaysFailing("Invalid object name 'HR.DEPT'.");

        RepairOutcome outcome = loop().repair(reviewedTable(), CONVERTED, deployer, store);

        assertEquals(1, search.getQueries().size());
        assertEquals("invalid object name ?.", search.getQueries().get(0));
        assertEquals(1, outcome.getAttempts().get(0).getSearchHits());
        assertEquals(0, outcome.getAttempts().get(1).getSearchHits());
        assertEquals(SolutionSource.WEB_SEARCH, outcome.getAttempts().get(0).getFixProvenance());

        TranslationRequest first = translator.getRequests().get(0);
        assertTrue(first.isRepair());
        assertTrue(first.getSections().stream()
                .anyMatch(s -> s.getType() == TranslationRequest.SectionType.SEARCH));
    }

    @Test
    void memoryHitSkipsSearchAndIsNotRelearned() {
        MigrationObject object = reviewedTable();
        String error = "Cannot insert explicit value for identity column in table 'EMPLOYEES'";
        String signature = classifier.signature(ObjectKind.TABLE, DeploymentErrorKind.IDENTITY_COLUMN, error);
        store.appendSolution(ErrorSolution.of(signature, "SET IDENTITY_INSERT [dbo].[EMPLOYEES] ON;",
                SolutionSource.WEB_SEARCH));

        FakeDeploymentExecutor deployer = new FakeDeploymentExecutor().thenFail(error).thenSucceed();
        RepairOutcome outcome = loop().repair(object, CONVERTED, deployer, store);

        assertTrue(outcome.isDeployed());
        assertTrue(search.getQueries().isEmpty());
        DeploymentAttempt first = outcome.getAttempts().get(0);
        assertEquals(1, first.getMemoryHits());
        assertEquals(SolutionSource.MEMORY, first.getFixProvenance());
        assertEquals(1, store.countSolutions(signature));

        TranslationRequest request = translator.getRequests().get(0);
        assertTrue(request.getSections().stream()
                .anyMatch(s -> s.getType() == TranslationRequest.SectionType.PATTERN
                        && s.getContent().contains("IDENTITY_INSERT")));
    }

    @Test
    void knownIdentityColumnsTravelWithTheRepairRequest() {
        store.upsertIdentityColumns("EMPLOYEES", List.of("EMP_ID"));
        FakeDeploymentExecutor deployer = new FakeDeploymentExecutor().thenFail("syntax error").thenSucceed();

        loop().repair(reviewedTable(), CONVERTED, deployer, store);

        TranslationRequest request = translator.getRequests().get(0);
        assertTrue(request.getSections().stream()
                .anyMatch(s -> s.getType() == TranslationRequest.SectionType.METADATA
                        && s.getContent().equals("EMP_ID")));
    }

    @Test
    void translatorFailureStopsTheLoop() {
        translator.failing();
        FakeDeploymentExecutor deployer = FakeDeploymentExecutor.alwaysFailing("Incorrect syntax near 'BEGIN'.");

        RepairOutcome outcome = loop().repair(reviewedTable(), CONVERTED, deployer, store);

        assertFalse(outcome.isDeployed());
        assertEquals(1, outcome.getAttempts().size());
        assertEquals(1, deployer.getDeployCount());
        assertNull(outcome.getAttempts().get(0).getFixApplied());
        assertEquals(CONVERTED, outcome.getFinalText());
        assertEquals(1, store.recentPatterns(ObjectKind.TABLE, MigrationPattern.Outcome.FAILURE, 5).size());
    }

    @Test
    void slowDeployCountsAsTimeoutFailure() {
        MigrationSettings settings = MigrationSettings.builder()
                .maxAttempts(1)
                .deploymentTimeout(Duration.ofMillis(200))
                .build();
        DeploymentExecutor slow = new DeploymentExecutor() {
            @Override
            public void ping() {
            }

            @Override
            public DeployResult deploy(String targetText) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return DeployResult.success();
            }

            @Override
            public boolean ensureSchema(String schemaName) {
                return false;
            }
        };

        RepairOutcome outcome = loop(settings).repair(reviewedTable(), CONVERTED, slow, store);

        assertFalse(outcome.isDeployed());
        assertEquals(1, outcome.getAttempts().size());
        assertEquals(DeploymentErrorKind.TIMEOUT, outcome.getAttempts().get(0).getErrorKind());
        assertTrue(outcome.getAttempts().get(0).getSignature().startsWith("Table:timeout:"));
    }

    @Test
    void singleAttemptBudgetNeverAsksForAFix() {
        MigrationSettings settings = MigrationSettings.builder().maxAttempts(1).build();
        FakeDeploymentExecutor deployer = FakeDeploymentExecutor.alwaysFailing("syntax error");

        RepairOutcome outcome = loop(settings).repair(reviewedTable(), CONVERTED, deployer, store);

        assertEquals(1, outcome.getAttempts().size());
        assertEquals(0, translator.getCallCount());
    }
}
