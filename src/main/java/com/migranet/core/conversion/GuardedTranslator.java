package com.migranet.core.conversion;

import com.migranet.config.MigrationSettings;
import com.migranet.core.executor.ExternalCallGuard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * The only path to the FallbackTranslator: row-data check, then one call under
 * the translator timeout. Timeouts, failures, blank output and Table payloads
 * carrying literal row values all surface as ConversionException; a refused
 * payload is never sent.
 */
@Component
public class GuardedTranslator {

    private static final Logger log = LoggerFactory.getLogger(GuardedTranslator.class);

    private final FallbackTranslator translator;
    private final ExternalCallGuard  callGuard;
    private final MigrationSettings  settings;

    public GuardedTranslator(FallbackTranslator translator, ExternalCallGuard callGuard, MigrationSettings settings) {
        this.translator = translator;
        this.callGuard  = callGuard;
        this.settings   = settings;
    }

    public String translate(TranslationRequest request) throws ConversionException {
        RowDataGuard.requireNoRowDataSection(request);
        Optional<TranslationRequest.Section> rows = RowDataGuard.findRowValues(request);
        if (rows.isPresent()) {
            log.warn("[Translator] {} payload withheld: '{}' holds INSERT ... VALUES literals",
                    request.getObjectName(), rows.get().getTitle());
            throw new ConversionException("Section '" + rows.get().getTitle() + "' for table "
                    + request.getObjectName() + " holds literal row values and cannot be sent to the translator");
        }

        String label = (request.isRepair() ? "repair " : "translate ") + request.getObjectName();
        log.debug("[Translator] {} sections={}", label, request.getSections().size());
        try {
            String text = callGuard.call(label, settings.getTranslatorTimeout(), () -> translator.translate(request));
            if (text == null || text.isBlank()) {
                throw new ConversionException("Translator returned no text for " + request.getObjectName());
            }
            return text;

        } catch (TimeoutException e) {
            throw new ConversionException("Translator timed out for " + request.getObjectName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConversionException) {
                throw (ConversionException) cause;
            }
            throw new ConversionException("Translator failed for " + request.getObjectName()
                    + ": " + cause.getMessage(), cause);
        }
    }
}
