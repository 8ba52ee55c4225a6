package com.migranet.testing;

import com.migranet.core.repair.DeployResult;
import com.migranet.core.repair.DeploymentExecutor;
import com.migranet.core.source.ConnectivityException;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scripted deployment target. Results are consumed in order; once the script is
 * exhausted the last scripted result repeats (success when nothing was scripted).
 *
 * Schemas: "dbo" exists up front; ensureSchema creates anything else.
 */
public class FakeDeploymentExecutor implements DeploymentExecutor {

    private final Deque<DeployResult> script = new ArrayDeque<>();
    private final List<String> deployedTexts = new ArrayList<>();
    private DeployResult last = DeployResult.success();
    private boolean reachable = true;
    private final Set<String> schemas = new HashSet<>(Set.of("DBO"));
    private final List<String> ensuredSchemas = new ArrayList<>();
    private boolean schemaCreationDenied;
    private int interruptOnDeploy;
    private Thread interruptTarget;

    public static FakeDeploymentExecutor alwaysSucceeding() {
        return new FakeDeploymentExecutor();
    }

    public static FakeDeploymentExecutor alwaysFailing(String error) {
        return new FakeDeploymentExecutor().thenFail(error);
    }

    public FakeDeploymentExecutor thenFail(String error) {
        script.add(DeployResult.failed(error));
        return this;
    }

    public FakeDeploymentExecutor thenSucceed() {
        script.add(DeployResult.success());
        return this;
    }

    public FakeDeploymentExecutor unreachable() {
        this.reachable = false;
        return this;
    }

    public FakeDeploymentExecutor denySchemaCreation() {
        this.schemaCreationDenied = true;
        return this;
    }

    /** The n-th deploy (1-based) interrupts {@code caller} and then blocks until cancelled. */
    public FakeDeploymentExecutor interruptCallerOnDeploy(int n, Thread caller) {
        this.interruptOnDeploy = n;
        this.interruptTarget   = caller;
        return this;
    }

    @Override
    public void ping() {
        if (!reachable) {
            throw new ConnectivityException("target down");
        }
    }

    @Override
    public DeployResult deploy(String targetText) {
        int n;
        synchronized (this) {
            deployedTexts.add(targetText);
            n = deployedTexts.size();
        }
        if (n == interruptOnDeploy) {
            interruptTarget.interrupt();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DeployResult.failed("interrupted");
        }
        synchronized (this) {
            if (!script.isEmpty()) {
                last = script.poll();
            }
            return last;
        }
    }

    @Override
    public synchronized boolean ensureSchema(String schemaName) throws SQLException {
        ensuredSchemas.add(schemaName);
        String key = schemaName.toUpperCase();
        if (schemas.contains(key)) {
            return false;
        }
        if (schemaCreationDenied) {
            throw new SQLException("CREATE SCHEMA permission denied in database 'APP'.");
        }
        schemas.add(key);
        return true;
    }

    public synchronized List<String> getEnsuredSchemas() {
        return new ArrayList<>(ensuredSchemas);
    }

    public synchronized List<String> getDeployedTexts() {
        return new ArrayList<>(deployedTexts);
    }

    public synchronized int getDeployCount() {
        return deployedTexts.size();
    }
}
