package com.migranet.integration.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.search.SearchHit;
import com.migranet.core.search.WebSearchClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WebSearchClient backed by the Tavily search API.
 *
 * Disabled (always returns no hits) when no API key is configured.
 * Search failures are logged and reported as no hits; repair continues without them.
 */
@Component
public class TavilyWebSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(TavilyWebSearchClient.class);

    private static final int MAX_SNIPPET_CHARS = 500;

    private final String       apiKey;
    private final String       baseUrl;
    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TavilyWebSearchClient(
            @Value("${migranet.search.api-key:}") String apiKey,
            @Value("${migranet.search.base-url:https://api.tavily.com}") String baseUrl
    ) {
        this.apiKey  = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = baseUrl;
        log.info("[Search] Web search {}", isEnabled() ? "enabled (Tavily)" : "disabled: no API key");
    }

    public boolean isEnabled() {
        return !apiKey.isEmpty();
    }

    @Override
    public List<SearchHit> search(String normalizedError, ObjectKind kind, int maxResults) {
        if (!isEnabled() || maxResults <= 0) {
            return List.of();
        }
        String query = buildQuery(normalizedError, kind);
        log.info("[Search] {}", query);

        try {
            Map<String, Object> body = new HashMap<>();
            body.put("api_key",             apiKey);
            body.put("query",               query);
            body.put("search_depth",        "advanced");
            body.put("max_results",         maxResults);
            body.put("include_answer",      false);
            body.put("include_raw_content", false);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/search", new HttpEntity<>(body, headers), String.class);

            List<SearchHit> hits = parse(response.getBody(), maxResults);
            log.info("[Search] {} result(s)", hits.size());
            return hits;

        } catch (RestClientException | IOException e) {
            log.warn("[Search] Tavily call failed: {}", e.getMessage());
            return List.of();
        }
    }

    static String buildQuery(String normalizedError, ObjectKind kind) {
        String error = normalizedError == null ? "" : normalizedError.replace('?', ' ').replace('#', ' ').trim();
        return "SQL Server T-SQL " + kind.getLabel().toLowerCase() + " error " + error
                + " fix migrating from Oracle";
    }

    List<SearchHit> parse(String json, int maxResults) throws IOException {
        List<SearchHit> hits = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return hits;
        }
        JsonNode results = objectMapper.readTree(json).path("results");
        for (JsonNode r : results) {
            if (hits.size() >= maxResults) break;
            String content = r.path("content").asText("");
            if (content.length() > MAX_SNIPPET_CHARS) {
                content = content.substring(0, MAX_SNIPPET_CHARS);
            }
            hits.add(new SearchHit(r.path("title").asText(""), r.path("url").asText(""), content));
        }
        return hits;
    }
}
