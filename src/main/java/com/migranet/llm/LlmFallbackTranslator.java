package com.migranet.llm;

import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.FallbackTranslator;
import com.migranet.core.conversion.TranslationRequest;
import com.migranet.core.usage.UsageTracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FallbackTranslator backed by an LLMClient.
 *
 * Prompt = one titled block per request section. The model answer is reduced to
 * the first fenced code block (```sql or bare ```), or the whole answer when
 * it has none. Every answered call is recorded in the UsageTracker.
 */
@Component
public class LlmFallbackTranslator implements FallbackTranslator {

    private static final Logger log = LoggerFactory.getLogger(LlmFallbackTranslator.class);

    private static final Pattern CODE_FENCE =
            Pattern.compile("```(?:sql|tsql|t-sql)?[ \\t]*\\R(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final LLMClient    llmClient;
    private final UsageTracker usageTracker;

    public LlmFallbackTranslator(LLMClient llmClient, UsageTracker usageTracker) {
        this.llmClient    = llmClient;
        this.usageTracker = usageTracker;
    }

    @Override
    public String translate(TranslationRequest request) throws ConversionException {
        LlmRole role = request.isRepair() ? LlmRole.REPAIRER : LlmRole.CONVERTER;
        String prompt = buildPrompt(request);

        String answer;
        try {
            answer = llmClient.generateWithRole(role, prompt, llmClient.getTemperatureForRole(role));
        } catch (RuntimeException e) {
            throw new ConversionException("LLM call failed for " + request.getObjectName() + ": " + e.getMessage(), e);
        }
        usageTracker.record(llmClient.getModelId(), prompt, answer);

        String sql = extractSql(answer);
        if (sql.isBlank()) {
            throw new ConversionException("LLM returned no SQL for " + request.getObjectName());
        }
        log.debug("[LlmTranslator] {} role={} → {} chars", request.getObjectName(), role, sql.length());
        return sql;
    }

    String buildPrompt(TranslationRequest request) {
        StringBuilder sb = new StringBuilder();
        if (request.isRepair()) {
            sb.append("Repair the SQL Server ").append(request.getKind().getLabel())
              .append(" ").append(request.getObjectName()).append(" so that it deploys.\n\n");
        } else {
            sb.append("Convert the Oracle ").append(request.getKind().getLabel())
              .append(" ").append(request.getObjectName()).append(" to SQL Server T-SQL.\n\n");
        }
        for (TranslationRequest.Section section : request.getSections()) {
            sb.append("### ").append(section.getType()).append(": ").append(section.getTitle()).append("\n");
            sb.append(section.getContent().strip()).append("\n\n");
        }
        sb.append("Return the complete T-SQL in one ```sql code block.");
        return sb.toString();
    }

    static String extractSql(String answer) {
        if (answer == null) return "";
        Matcher m = CODE_FENCE.matcher(answer);
        if (m.find()) {
            return m.group(1).strip();
        }
        return answer.strip();
    }
}
