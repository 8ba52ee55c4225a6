package com.migranet.core.conversion;

import com.migranet.config.ConversionModeResolver;
import com.migranet.config.MigrationSettings;
import com.migranet.core.executor.ExternalCallGuard;
import com.migranet.core.memory.MemoryStore;
import com.migranet.core.memory.MigrationPattern;
import com.migranet.core.model.MigrationObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * ConversionRouter: picks the converter for one object.
 *
 * PRIMARY_FIRST:
 *   primary → accept when errors == 0 and warnings <= threshold
 *           → otherwise exactly one fallback call
 *   A primary failure or timeout is logged and treated as "not acceptable".
 *   If the fallback then fails, non-blank primary text is kept with a warning.
 *
 * FALLBACK_ONLY:
 *   fallback only; its failure is a ConversionException.
 *
 * Conversion failures never consume repair attempts.
 */
@Component
public class ConversionRouter {

    private static final Logger log = LoggerFactory.getLogger(ConversionRouter.class);

    private final PrimaryConverter       primary;
    private final GuardedTranslator      translator;
    private final ConversionModeResolver modeResolver;
    private final ExternalCallGuard      callGuard;
    private final MigrationSettings      settings;

    public ConversionRouter(
            PrimaryConverter primary,
            GuardedTranslator translator,
            ConversionModeResolver modeResolver,
            ExternalCallGuard callGuard,
            MigrationSettings settings
    ) {
        this.primary      = primary;
        this.translator   = translator;
        this.modeResolver = modeResolver;
        this.callGuard    = callGuard;
        this.settings     = settings;
    }

    public ConversionResult convert(MigrationObject object, MemoryStore store) throws ConversionException {
        String label = object.getQualifiedName();
        ConversionResult primaryResult = null;

        if (modeResolver.isPrimaryFirst() && primary.isAvailable()) {
            primaryResult = runPrimary(object);

            if (primaryResult != null && isAcceptable(primaryResult)) {
                log.info("[Router] {} accepted primary output (warnings={})",
                        label, primaryResult.getWarningCount());
                return primaryResult;
            }
            if (primaryResult != null) {
                log.info("[Router] {} primary output rejected (errors={}, warnings={}, threshold={}) → fallback",
                        label, primaryResult.getErrorCount(), primaryResult.getWarningCount(),
                        settings.getWarningThreshold());
            }
        }

        try {
            String text = runFallback(object, store);
            log.info("[Router] {} converted by fallback translator", label);
            return ConversionResult.fallback(text);

        } catch (ConversionException e) {
            if (primaryResult != null && primaryResult.hasText()) {
                log.warn("[Router] {} fallback failed ({}); keeping primary output despite diagnostics",
                        label, e.getMessage());
                return primaryResult;
            }
            throw e;
        }
    }

    private boolean isAcceptable(ConversionResult result) {
        return result.getErrorCount() == 0 && result.getWarningCount() <= settings.getWarningThreshold();
    }

    // =========================================================================
    // Primary
    // =========================================================================

    private ConversionResult runPrimary(MigrationObject object) {
        String label = "primary " + object.getQualifiedName();
        try {
            PrimaryConverter.PrimaryOutput output = callGuard.call(label, settings.getConversionTimeout(),
                    () -> primary.convert(object.getSourceDefinition(), object.getKind()));

            ConverterDiagnostics diagnostics = ConverterDiagnostics.parse(output);
            return new ConversionResult(ConversionTool.PRIMARY, output.getConvertedText(),
                    diagnostics.getErrorCount(), diagnostics.getWarningCount());

        } catch (TimeoutException e) {
            log.warn("[Router] {} primary converter timed out", object.getQualifiedName());
            return null;
        } catch (ExecutionException e) {
            log.warn("[Router] {} primary converter failed: {}",
                    object.getQualifiedName(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }

    // =========================================================================
    // Fallback
    // =========================================================================

    private String runFallback(MigrationObject object, MemoryStore store) throws ConversionException {
        return translator.translate(buildRequest(object, store));
    }

    TranslationRequest buildRequest(MigrationObject object, MemoryStore store) {
        TranslationRequest.SectionType sourceType = object.getKind().isStructural()
                ? TranslationRequest.SectionType.DDL
                : TranslationRequest.SectionType.CODE;

        TranslationRequest.Builder builder = TranslationRequest.builder(object.getName(), object.getKind())
                .section(sourceType, "Source " + object.getKind().getLabel(), object.getSourceDefinition());

        List<String> identity = store.getIdentityColumns(object.getName());
        if (!identity.isEmpty()) {
            builder.section(TranslationRequest.SectionType.METADATA, "Known identity columns",
                    String.join(", ", identity));
        }

        List<MigrationPattern> patterns = store.recentPatterns(
                object.getKind(), MigrationPattern.Outcome.SUCCESS, settings.getPatternLimit());
        for (MigrationPattern p : patterns) {
            builder.section(TranslationRequest.SectionType.PATTERN,
                    "Successful " + p.getKind().getLabel() + " " + p.getObjectName(), p.getFixSummary());
        }
        return builder.build();
    }
}
