package com.migranet.integration.oracle;

import com.migranet.core.model.ObjectKind;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OracleSourceCatalogTest {

    private static final String PACKAGE_BODY =
            "PACKAGE BODY EMP_PKG AS\n"
            + "  PROCEDURE log_change(p_id NUMBER);\n"
            + "\n"
            + "  FUNCTION get_salary(p_id NUMBER) RETURN NUMBER IS\n"
            + "    v NUMBER;\n"
            + "  BEGIN\n"
            + "    SELECT SALARY INTO v FROM EMPLOYEES WHERE ID = p_id;\n"
            + "    RETURN v;\n"
            + "  END get_salary;\n"
            + "\n"
            + "  PROCEDURE log_change(p_id NUMBER) IS\n"
            + "  BEGIN\n"
            + "    INSERT INTO AUDIT_LOG (EMP_ID) VALUES (p_id);\n"
            + "  END log_change;\n"
            + "END EMP_PKG;\n";

    @Test
    void extractsFunctionMember() {
        String member = OracleSourceCatalog.extractMember(PACKAGE_BODY, "GET_SALARY");

        assertTrue(member.startsWith("CREATE OR REPLACE FUNCTION get_salary"), member);
        assertTrue(member.endsWith("END get_salary;"));
        assertFalse(member.contains("log_change"));
    }

    @Test
    void skipsForwardDeclaration() {
        String member = OracleSourceCatalog.extractMember(PACKAGE_BODY, "log_change");

        assertTrue(member.startsWith("CREATE OR REPLACE PROCEDURE log_change(p_id NUMBER) IS"), member);
        assertTrue(member.contains("INSERT INTO AUDIT_LOG"));
        assertFalse(member.contains("get_salary"));
    }

    @Test
    void absentMemberIsEmpty() {
        assertEquals("", OracleSourceCatalog.extractMember(PACKAGE_BODY, "FIRE_EMP"));
        assertEquals("", OracleSourceCatalog.extractMember("", "X"));
    }

    @Test
    void sourceTypeForCodeObjects() {
        assertEquals("PROCEDURE", OracleSourceCatalog.sourceType(ObjectKind.PROCEDURE));
        assertEquals("TRIGGER", OracleSourceCatalog.sourceType(ObjectKind.TRIGGER));
        assertThrows(IllegalArgumentException.class, () -> OracleSourceCatalog.sourceType(ObjectKind.TABLE));
    }
}
