package com.migranet.integration.sqlserver;

import com.migranet.config.AdapterConfig;
import com.migranet.config.ConnectionCredentials;
import com.migranet.core.repair.DeployResult;
import com.migranet.core.repair.DeploymentExecutor;
import com.migranet.core.source.ConnectivityException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Deploys T-SQL to SQL Server, one JDBC statement per GO batch, in one connection.
 * The first failing batch stops the deployment; its SQLException text is the raw error.
 */
@Component
public class SqlServerDeploymentExecutor implements DeploymentExecutor {

    private static final Logger log = LoggerFactory.getLogger(SqlServerDeploymentExecutor.class);

    private static final String SCHEMA_EXISTS_SQL =
            "SELECT 1 FROM INFORMATION_SCHEMA.SCHEMATA WHERE SCHEMA_NAME = ?";

    private final ConnectionCredentials credentials;

    public SqlServerDeploymentExecutor(@Qualifier(AdapterConfig.TARGET_CREDENTIALS) ConnectionCredentials credentials) {
        this.credentials = credentials;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(credentials.getUrl(), credentials.getUser(), credentials.getPassword());
    }

    @Override
    public void ping() {
        try (Connection connection = getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("SELECT 1");
            log.info("[SqlServer] Connection OK ({})", credentials.getUrl());
        } catch (SQLException e) {
            throw new ConnectivityException("SQL Server target unreachable at " + credentials.getUrl()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public DeployResult deploy(String targetText) {
        List<String> batches = SqlBatchSplitter.split(targetText);
        if (batches.isEmpty()) {
            return DeployResult.failed("Nothing to deploy: script is empty");
        }

        try (Connection connection = getConnection();
             Statement statement = connection.createStatement()) {

            for (int i = 0; i < batches.size(); i++) {
                try {
                    statement.execute(batches.get(i));
                } catch (SQLException e) {
                    log.debug("[SqlServer] Batch {}/{} failed: {}", i + 1, batches.size(), e.getMessage());
                    return DeployResult.failed(describe(e));
                }
            }
            log.debug("[SqlServer] Deployed {} batch(es)", batches.size());
            return DeployResult.success();

        } catch (SQLException e) {
            return DeployResult.failed(describe(e));
        }
    }

    @Override
    public boolean ensureSchema(String schemaName) throws SQLException {
        try (Connection connection = getConnection()) {
            try (PreparedStatement ps = connection.prepareStatement(SCHEMA_EXISTS_SQL)) {
                ps.setString(1, schemaName);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        log.debug("[SqlServer] Schema [{}] already exists", schemaName);
                        return false;
                    }
                }
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE SCHEMA " + quoteIdentifier(schemaName));
            }
            log.info("[SqlServer] Created schema [{}]", schemaName);
            return true;
        }
    }

    static String quoteIdentifier(String name) {
        return "[" + name.replace("]", "]]") + "]";
    }

    private static String describe(SQLException e) {
        StringBuilder sb = new StringBuilder();
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("Msg ").append(cur.getErrorCode()).append(": ").append(cur.getMessage());
        }
        return sb.toString();
    }
}
