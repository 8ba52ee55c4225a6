package com.migranet.integration.sqlserver;

import com.migranet.config.AdapterConfig;
import com.migranet.config.ConnectionCredentials;
import com.migranet.core.memory.ObjectDescription;
import com.migranet.core.memory.ObjectDescription.ColumnDescription;
import com.migranet.core.memory.ObjectDescription.ConstraintDescription;
import com.migranet.core.metadata.MetadataRefresher;
import com.migranet.core.model.MigrationObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a deployed table's columns (with identity flags) and constraints back
 * from INFORMATION_SCHEMA. Code objects get an existence check only.
 */
@Component
public class SqlServerMetadataRefresher implements MetadataRefresher {

    private static final Logger log = LoggerFactory.getLogger(SqlServerMetadataRefresher.class);

    private static final String COLUMNS_SQL =
            "SELECT c.COLUMN_NAME, c.DATA_TYPE, c.CHARACTER_MAXIMUM_LENGTH, c.IS_NULLABLE, "
            + "COLUMNPROPERTY(OBJECT_ID(QUOTENAME(c.TABLE_SCHEMA) + '.' + QUOTENAME(c.TABLE_NAME)), "
            + "c.COLUMN_NAME, 'IsIdentity') AS IS_IDENTITY "
            + "FROM INFORMATION_SCHEMA.COLUMNS c "
            + "WHERE c.TABLE_SCHEMA = ? AND c.TABLE_NAME = ? ORDER BY c.ORDINAL_POSITION";

    private static final String CONSTRAINTS_SQL =
            "SELECT tc.CONSTRAINT_NAME, tc.CONSTRAINT_TYPE, kcu.COLUMN_NAME "
            + "FROM INFORMATION_SCHEMA.TABLE_CONSTRAINTS tc "
            + "LEFT JOIN INFORMATION_SCHEMA.KEY_COLUMN_USAGE kcu "
            + "  ON tc.CONSTRAINT_NAME = kcu.CONSTRAINT_NAME AND tc.TABLE_SCHEMA = kcu.TABLE_SCHEMA "
            + "WHERE tc.TABLE_SCHEMA = ? AND tc.TABLE_NAME = ? "
            + "ORDER BY tc.CONSTRAINT_NAME, kcu.ORDINAL_POSITION";

    private static final String EXISTS_SQL =
            "SELECT 1 FROM sys.objects o JOIN sys.schemas s ON o.schema_id = s.schema_id "
            + "WHERE s.name = ? AND o.name = ?";

    private final ConnectionCredentials credentials;

    public SqlServerMetadataRefresher(@Qualifier(AdapterConfig.TARGET_CREDENTIALS) ConnectionCredentials credentials) {
        this.credentials = credentials;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(credentials.getUrl(), credentials.getUser(), credentials.getPassword());
    }

    @Override
    public ObjectDescription describe(MigrationObject object, String targetSchema) throws SQLException {
        String name = object.getName();
        try (Connection connection = getConnection()) {
            if (!object.getKind().isStructural()) {
                if (!exists(connection, targetSchema, name)) {
                    log.warn("[SqlServer] {}.{} not found after deployment", targetSchema, name);
                }
                return new ObjectDescription(targetSchema, name, object.getKind(), List.of(), List.of());
            }
            List<ColumnDescription> columns = columns(connection, targetSchema, name);
            List<ConstraintDescription> constraints = constraints(connection, targetSchema, name);
            return new ObjectDescription(targetSchema, name, object.getKind(), columns, constraints);
        }
    }

    private boolean exists(Connection connection, String schema, String name) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(EXISTS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<ColumnDescription> columns(Connection connection, String schema, String table) throws SQLException {
        List<ColumnDescription> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String dataType = rs.getString("DATA_TYPE");
                    int length = rs.getInt("CHARACTER_MAXIMUM_LENGTH");
                    if (!rs.wasNull()) {
                        dataType += "(" + (length < 0 ? "MAX" : String.valueOf(length)) + ")";
                    }
                    columns.add(new ColumnDescription(
                            rs.getString("COLUMN_NAME"),
                            dataType,
                            "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")),
                            rs.getInt("IS_IDENTITY") == 1));
                }
            }
        }
        return columns;
    }

    private List<ConstraintDescription> constraints(Connection connection, String schema, String table)
            throws SQLException {
        Map<String, String> types = new LinkedHashMap<>();
        Map<String, List<String>> columns = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(CONSTRAINTS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("CONSTRAINT_NAME");
                    types.putIfAbsent(name, rs.getString("CONSTRAINT_TYPE"));
                    List<String> cols = columns.computeIfAbsent(name, n -> new ArrayList<>());
                    String column = rs.getString("COLUMN_NAME");
                    if (column != null) cols.add(column);
                }
            }
        }
        List<ConstraintDescription> result = new ArrayList<>();
        types.forEach((name, type) -> result.add(new ConstraintDescription(name, type, columns.get(name))));
        return result;
    }
}
