package com.migranet.core.conversion;

import com.migranet.config.MigrationSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemaReferenceRewriterTest {

    private final SchemaReferenceRewriter rewriter =
            new SchemaReferenceRewriter(MigrationSettings.builder().build());

    @Test
    void stockSchemaQualifierIsReplaced() {
        String out = rewriter.rewrite("SELECT * FROM HR.EMPLOYEES e JOIN [SCOTT].[DEPT] d ON 1 = 1", null);

        assertEquals("SELECT * FROM [dbo].[EMPLOYEES] e JOIN [dbo].[DEPT] d ON 1 = 1", out);
    }

    @Test
    void objectSourceSchemaIsReplacedCaseInsensitively() {
        String out = rewriter.rewrite("UPDATE payroll.SALARIES SET AMOUNT = 0", "PAYROLL");

        assertEquals("UPDATE [dbo].[SALARIES] SET AMOUNT = 0", out);
    }

    @Test
    void aliasesAndForeignSchemasAreLeftAlone() {
        String sql = "SELECT e.NAME FROM [dbo].[EMPLOYEES] e JOIN audit.LOG l ON e.ID = l.ID";

        assertEquals(sql, rewriter.rewrite(sql, "HR"));
    }

    @Test
    void unqualifiedCreateGetsTargetSchema() {
        String out = rewriter.rewrite("CREATE OR ALTER PROCEDURE GET_EMP AS SELECT 1", null);

        assertEquals("CREATE OR ALTER PROCEDURE [dbo].[GET_EMP] AS SELECT 1", out);
    }

    @Test
    void createTableWithParenthesisIsQualified() {
        String out = rewriter.rewrite("CREATE TABLE EMPLOYEES(ID INT)", null);

        assertEquals("CREATE TABLE [dbo].[EMPLOYEES](ID INT)", out);
    }

    @Test
    void configuredTargetSchemaIsUsed() {
        SchemaReferenceRewriter custom =
                new SchemaReferenceRewriter(MigrationSettings.builder().targetSchema("app").build());

        assertEquals("CREATE VIEW [app].[V_EMP] AS SELECT * FROM [app].[EMP]",
                custom.rewrite("CREATE VIEW V_EMP AS SELECT * FROM HR.EMP", null));
    }

    @Test
    void emptyInputIsReturnedAsIs() {
        assertEquals("", rewriter.rewrite("", "HR"));
        assertNull(rewriter.rewrite(null, "HR"));
    }
}
