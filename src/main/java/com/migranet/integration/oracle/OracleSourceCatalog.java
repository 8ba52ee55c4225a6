package com.migranet.integration.oracle;

import com.migranet.config.AdapterConfig;
import com.migranet.config.ConnectionCredentials;
import com.migranet.core.model.MigrationObject;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.source.ConnectivityException;
import com.migranet.core.source.SourceCatalog;

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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Oracle source catalog over plain JDBC.
 *
 * Tables:          DBMS_METADATA.GET_DDL
 * Code objects:    ALL_SOURCE ordered by LINE, prefixed with CREATE OR REPLACE
 * Package members: the member's PROCEDURE/FUNCTION block cut out of the PACKAGE BODY
 */
@Component
public class OracleSourceCatalog implements SourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(OracleSourceCatalog.class);

    private static final String TABLE_DDL_SQL =
            "SELECT DBMS_METADATA.GET_DDL('TABLE', ?, ?) FROM DUAL";

    private static final String SOURCE_SQL =
            "SELECT TEXT FROM ALL_SOURCE WHERE OWNER = ? AND NAME = ? AND TYPE = ? ORDER BY LINE";

    private final ConnectionCredentials credentials;

    public OracleSourceCatalog(@Qualifier(AdapterConfig.SOURCE_CREDENTIALS) ConnectionCredentials credentials) {
        this.credentials = credentials;
    }

    Connection getConnection() throws SQLException {
        log.debug("[Oracle] Connecting to {}", credentials.getUrl());
        return DriverManager.getConnection(credentials.getUrl(), credentials.getUser(), credentials.getPassword());
    }

    @Override
    public void ping() {
        try (Connection connection = getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT 1 FROM DUAL")) {
            rs.next();
            log.info("[Oracle] Connection OK ({})", credentials.getUrl());
        } catch (SQLException e) {
            throw new ConnectivityException("Oracle source unreachable at " + credentials.getUrl()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String fetchDefinition(MigrationObject object) throws SQLException {
        String owner = ownerOf(object);
        String name  = object.getName().toUpperCase(Locale.ROOT);

        try (Connection connection = getConnection()) {
            switch (object.getKind()) {
                case TABLE:
                    return tableDdl(connection, owner, name);
                case PACKAGE_MEMBER:
                    String body = sourceText(connection, owner,
                            object.getParentPackage().toUpperCase(Locale.ROOT), "PACKAGE BODY");
                    return extractMember(body, name);
                default:
                    String text = sourceText(connection, owner, name, sourceType(object.getKind()));
                    return text.isEmpty() ? "" : "CREATE OR REPLACE " + text;
            }
        }
    }

    private String ownerOf(MigrationObject object) {
        String schema = object.getSchema();
        return (schema != null && !schema.isBlank() ? schema : credentials.getUser()).toUpperCase(Locale.ROOT);
    }

    private String tableDdl(Connection connection, String owner, String name) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(TABLE_DDL_SQL)) {
            ps.setString(1, name);
            ps.setString(2, owner);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null ? rs.getString(1).trim() : "";
            }
        }
    }

    private String sourceText(Connection connection, String owner, String name, String type) throws SQLException {
        StringBuilder sb = new StringBuilder();
        try (PreparedStatement ps = connection.prepareStatement(SOURCE_SQL)) {
            ps.setString(1, owner);
            ps.setString(2, name);
            ps.setString(3, type);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String line = rs.getString(1);
                    if (line != null) sb.append(line);
                }
            }
        }
        log.debug("[Oracle] {} {}.{}: {} chars", type, owner, name, sb.length());
        return sb.toString();
    }

    static String sourceType(ObjectKind kind) {
        switch (kind) {
            case PROCEDURE: return "PROCEDURE";
            case FUNCTION:  return "FUNCTION";
            case TRIGGER:   return "TRIGGER";
            default:
                throw new IllegalArgumentException("No ALL_SOURCE type for " + kind);
        }
    }

    /**
     * Cut "PROCEDURE|FUNCTION name ... END [name];" out of a package body and make
     * it a standalone CREATE OR REPLACE statement. Empty when the member is absent.
     */
    static String extractMember(String packageBody, String memberName) {
        if (packageBody == null || packageBody.isEmpty()) {
            return "";
        }
        Pattern member = Pattern.compile(
                "\\b(PROCEDURE|FUNCTION)\\s+" + Pattern.quote(memberName) + "\\b.*?\\bEND\\s+"
                        + Pattern.quote(memberName) + "\\s*;",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        Matcher m = member.matcher(packageBody);
        int from = 0;
        while (from < packageBody.length() && m.find(from)) {
            String block = m.group();
            // forward declaration ("PROCEDURE x(...);"): retry from just past its keyword
            if (isForwardDeclaration(block)) {
                from = m.start() + 1;
                continue;
            }
            return "CREATE OR REPLACE " + block.trim();
        }
        return "";
    }

    private static boolean isForwardDeclaration(String block) {
        Matcher header = Pattern.compile("^[^;]*?\\b(IS|AS)\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
                .matcher(block);
        return !header.find();
    }
}
