package com.migranet.core.review;

import com.migranet.core.model.ObjectKind;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based reviewer: flags source-dialect constructs that survived conversion.
 */
@Component
public class StaticCodeReviewer implements CodeReviewer {

    private static final Map<Pattern, String> LEFTOVER_CONSTRUCTS = new LinkedHashMap<>();

    static {
        leftover("\\bNVL2?\\s*\\(",          "NVL/NVL2 should be ISNULL or COALESCE");
        leftover("\\bDECODE\\s*\\(",         "DECODE should be a CASE expression");
        leftover("\\bSYSDATE\\b",            "SYSDATE should be GETDATE() or SYSDATETIME()");
        leftover("\\bVARCHAR2\\b",           "VARCHAR2 should be VARCHAR/NVARCHAR");
        leftover(":(NEW|OLD)\\.",            ":NEW/:OLD references should use the inserted/deleted tables");
        leftover("\\bDBMS_OUTPUT\\.",        "DBMS_OUTPUT should be PRINT");
        leftover("\\bROWNUM\\b",             "ROWNUM should be TOP or ROW_NUMBER()");
        leftover("\\bCONNECT\\s+BY\\b",      "CONNECT BY should be a recursive CTE");
        leftover("\\bFROM\\s+DUAL\\b",       "FROM DUAL is not needed");
        leftover("\\bELSIF\\b",              "ELSIF should be ELSE IF");
    }

    private static void leftover(String regex, String message) {
        LEFTOVER_CONSTRUCTS.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), message);
    }

    @Override
    public List<ReviewFinding> review(String sourceText, String targetText, ObjectKind kind) {
        List<ReviewFinding> findings = new ArrayList<>();

        if (targetText == null || targetText.isBlank()) {
            findings.add(new ReviewFinding(ReviewFinding.Severity.CRITICAL, "Converted output is empty"));
            return findings;
        }

        for (Map.Entry<Pattern, String> rule : LEFTOVER_CONSTRUCTS.entrySet()) {
            if (rule.getKey().matcher(targetText).find()) {
                findings.add(new ReviewFinding(ReviewFinding.Severity.CRITICAL, rule.getValue()));
            }
        }

        if (!kind.isStructural() && !targetText.toUpperCase().contains("CREATE")) {
            findings.add(new ReviewFinding(ReviewFinding.Severity.WARNING,
                    "No CREATE statement in converted " + kind.getLabel()));
        }
        return findings;
    }
}
