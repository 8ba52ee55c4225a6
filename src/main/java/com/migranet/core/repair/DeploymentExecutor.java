package com.migranet.core.repair;

import java.sql.SQLException;

/**
 * Target-side deployment. Implementations report database errors through
 * DeployResult.failed rather than throwing.
 */
public interface DeploymentExecutor {

    /** @throws com.migranet.core.source.ConnectivityException when the target is unreachable */
    void ping();

    DeployResult deploy(String targetText);

    /**
     * Create the target schema when it does not exist yet.
     *
     * @return true when the schema was created, false when it was already there
     */
    boolean ensureSchema(String schemaName) throws SQLException;
}
