package com.migranet.core.classifier;

import com.migranet.core.model.ObjectKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "Query timeout expired                                                       | TIMEOUT",
        "The operation timed out while waiting for the server                        | TIMEOUT",
        "Lock request time out period exceeded.                                      | TIMEOUT",
        "ORA-identity-001                                                            | IDENTITY_COLUMN",
        "Cannot insert explicit value for identity column in table 'EMP' when IDENTITY_INSERT is set to OFF. | IDENTITY_COLUMN",
        "The SELECT permission was denied on the object 'EMP'                        | PERMISSION",
        "ORA-01031: insufficient privileges                                          | PERMISSION",
        "Invalid object name 'dbo.DEPARTMENTS'.                                      | MISSING_OBJECT",
        "ORA-00942: table or view does not exist                                     | MISSING_OBJECT",
        "'NVL' is not a recognized built-in function name.                           | MISSING_OBJECT",
        "Operand type clash: int is incompatible with date                           | TYPE_MISMATCH",
        "Conversion failed when converting the varchar value 'abc' to data type int. | TYPE_MISMATCH",
        "Incorrect syntax near 'timeout'.                                            | SYNTAX",
        "syntax near X                                                               | SYNTAX",
        "Must declare the scalar variable @ID.                                       | SYNTAX",
        "PLS-00103: Encountered the symbol END                                       | SYNTAX",
        "Something unexpected happened                                               | UNKNOWN"
    })
    void classifiesByFirstMatchingRule(String raw, DeploymentErrorKind expected) {
        assertEquals(expected, classifier.classify(raw));
    }

    @Test
    void blankAndNullAreUnknown() {
        assertEquals(DeploymentErrorKind.UNKNOWN, classifier.classify(null));
        assertEquals(DeploymentErrorKind.UNKNOWN, classifier.classify("   "));
    }

    @Test
    void earlierRuleWinsWhenSeveralMatch() {
        // identity wording together with a permission message
        String raw = "IDENTITY_INSERT failed: permission denied on table EMP";
        assertEquals(DeploymentErrorKind.IDENTITY_COLUMN, classifier.classify(raw));
    }

    @Test
    void classificationIsDeterministic() {
        String raw = "Invalid object name 'X'. Incorrect syntax near 'Y'.";
        DeploymentErrorKind first = classifier.classify(raw);
        for (int i = 0; i < 20; i++) {
            assertEquals(first, classifier.classify(raw));
        }
    }

    @Test
    void normalizeMasksIdentifiersAndDigits() {
        String normalized = classifier.normalize("Invalid object name 'HR.EMP_123'.   Line 42\n  [dbo].[T]");
        assertEquals("invalid object name ?. line # ?.?", normalized);
    }

    @Test
    void normalizeTruncatesLongMessages() {
        String raw = "error ".repeat(100);
        String normalized = classifier.normalize(raw);
        assertTrue(normalized.length() <= ErrorClassifier.MAX_SIGNATURE_TEXT);
        assertTrue(normalized.startsWith("error error"));
    }

    @Test
    void signatureCombinesKindErrorKindAndNormalizedText() {
        String raw = "Cannot insert explicit value for identity column in table 'EMP'";
        String signature = classifier.signature(ObjectKind.TABLE, classifier.classify(raw), raw);

        assertEquals("Table:identity-column:cannot insert explicit value for identity column in table ?", signature);
    }

    @Test
    void sameErrorOnDifferentObjectsSharesSignature() {
        String a = classifier.signature(ObjectKind.PROCEDURE, DeploymentErrorKind.MISSING_OBJECT,
                "Invalid object name 'ORDERS'.");
        String b = classifier.signature(ObjectKind.PROCEDURE, DeploymentErrorKind.MISSING_OBJECT,
                "Invalid object name 'CUSTOMERS'.");
        assertEquals(a, b);
    }
}
