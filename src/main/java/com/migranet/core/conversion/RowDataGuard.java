package com.migranet.core.conversion;

import com.migranet.core.model.ObjectKind;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last check before a payload leaves the process for the fallback translator.
 *
 * Table data never goes to an external translator:
 *   ROW_DATA section              → IllegalStateException; the caller built a bad request
 *   INSERT ... VALUES (...) text  → found by findRowValues for Table payloads; source or
 *                                   converter text carried data, the call is refused
 *                                   (GuardedTranslator turns it into a ConversionException)
 */
public final class RowDataGuard {

    private static final Pattern INSERT_WITH_VALUES = Pattern.compile(
            "\\bINSERT\\s+INTO\\b[\\s\\S]*?\\bVALUES\\s*\\(", Pattern.CASE_INSENSITIVE);

    private RowDataGuard() {}

    public static void requireNoRowDataSection(TranslationRequest request) {
        for (TranslationRequest.Section section : request.getSections()) {
            if (section.getType() == TranslationRequest.SectionType.ROW_DATA) {
                throw new IllegalStateException(
                        "Row data section '" + section.getTitle() + "' in translator payload for "
                        + request.getObjectName());
            }
        }
    }

    /** First section of a Table payload holding INSERT ... VALUES literals. */
    public static Optional<TranslationRequest.Section> findRowValues(TranslationRequest request) {
        if (request.getKind() != ObjectKind.TABLE) {
            return Optional.empty();
        }
        return request.getSections().stream()
                .filter(section -> INSERT_WITH_VALUES.matcher(section.getContent()).find())
                .findFirst();
    }
}
