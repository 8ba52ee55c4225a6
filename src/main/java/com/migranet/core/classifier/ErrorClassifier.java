package com.migranet.core.classifier;

import com.migranet.core.model.ObjectKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ErrorClassifier: maps raw deployment error text to a DeploymentErrorKind.
 *
 * Rule precedence (first match wins; the order is part of the contract because
 * one message can match several rules):
 *
 * 1. TIMEOUT          "timeout expired", "timed out", "query timeout"
 * 2. IDENTITY_COLUMN  IDENTITY_INSERT, explicit identity values, ORA-identity
 * 3. PERMISSION       permission denied, insufficient privileges, ORA-01031
 * 4. MISSING_OBJECT   invalid object name, does not exist, ORA-00942
 * 5. TYPE_MISMATCH    operand type clash, conversion failed, ORA-00932
 * 6. SYNTAX           incorrect syntax, syntax near, must declare, PLS-00103
 * 7. UNKNOWN
 *
 * Stateless and deterministic; safe to share.
 */
@Component
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    static final int MAX_SIGNATURE_TEXT = 100;

    private static final List<Rule> RULES = List.of(
        new Rule(DeploymentErrorKind.TIMEOUT,
            "\\btimeout expired\\b|\\btimed out\\b|\\bquery timeout\\b|\\block request time out\\b"),
        new Rule(DeploymentErrorKind.IDENTITY_COLUMN,
            "identity_insert|explicit value for (the )?identity|\\bidentity column|\\bora-identity"),
        new Rule(DeploymentErrorKind.PERMISSION,
            "permission denied|permission was denied|insufficient privileges|\\bora-01031\\b|do not have permission"),
        new Rule(DeploymentErrorKind.MISSING_OBJECT,
            "invalid object name|does not exist|could not find|cannot find the object|\\bora-00942\\b|\\bora-04043\\b"
                + "|is not a recognized [a-z -]*function"),
        new Rule(DeploymentErrorKind.TYPE_MISMATCH,
            "operand type clash|conversion failed|implicit conversion|arithmetic overflow|type mismatch|\\bora-00932\\b"),
        new Rule(DeploymentErrorKind.SYNTAX,
            "incorrect syntax|syntax error|syntax near|must declare|\\bora-00900\\b|\\bpls-00103\\b")
    );

    // Normalization: identifiers in quotes/brackets and digit runs vary per object
    private static final Pattern QUOTED_IDENTIFIER = Pattern.compile("'[^'\\n]*'|\"[^\"\\n]*\"|\\[[^\\]\\n]*\\]");
    private static final Pattern DIGITS            = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE        = Pattern.compile("\\s+");

    public DeploymentErrorKind classify(String rawError) {
        if (rawError == null || rawError.isBlank()) {
            return DeploymentErrorKind.UNKNOWN;
        }
        String lower = rawError.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.pattern.matcher(lower).find()) {
                log.debug("[Classifier] {} ← {}", rule.kind, abbreviate(rawError));
                return rule.kind;
            }
        }
        return DeploymentErrorKind.UNKNOWN;
    }

    /**
     * Canonical error text: lower-cased, quoted identifiers → ?, digits → #,
     * whitespace collapsed, capped at 100 chars.
     */
    public String normalize(String rawError) {
        if (rawError == null) return "";
        String text = rawError.toLowerCase(Locale.ROOT);
        text = QUOTED_IDENTIFIER.matcher(text).replaceAll("?");
        text = DIGITS.matcher(text).replaceAll("#");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return text.length() > MAX_SIGNATURE_TEXT ? text.substring(0, MAX_SIGNATURE_TEXT).trim() : text;
    }

    /** Signature "<ObjectKind>:<error-kind>:<normalized text>", the memory store key. */
    public String signature(ObjectKind objectKind, DeploymentErrorKind errorKind, String rawError) {
        return objectKind.getLabel() + ":" + errorKind.getCode() + ":" + normalize(rawError);
    }

    private static String abbreviate(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() > 80 ? flat.substring(0, 80) + "..." : flat;
    }

    private static final class Rule {
        final DeploymentErrorKind kind;
        final Pattern             pattern;

        Rule(DeploymentErrorKind kind, String regex) {
            this.kind    = kind;
            this.pattern = Pattern.compile(regex);
        }
    }
}
