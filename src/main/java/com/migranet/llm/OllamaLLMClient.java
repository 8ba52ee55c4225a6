package com.migranet.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient: default LLMClient backed by a local Ollama server.
 *
 * Implements only generateWithRole(). Active unless the gemini or mock profile is.
 */
@Component
@Profile("!gemini & !mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper  = new ObjectMapper();

    @Override
    public String generateWithRole(LlmRole role, String userPrompt, double temperature) {
        String fullPrompt = SystemPrompts.forRole(role) + "\n\n" + userPrompt;

        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, fullPrompt.length());

        return callOllama(fullPrompt, temperature);
    }

    @Override
    public String getModelId() {
        return "ollama/" + model;
    }

    private String callOllama(String prompt, double temperature) {
        try {
            String url = baseUrl + "/api/generate";

            Map<String, Object> options = new HashMap<>();
            options.put("temperature", temperature);

            Map<String, Object> body = new HashMap<>();
            body.put("model",   model);
            body.put("prompt",  prompt);
            body.put("options", options);
            body.put("stream",  false);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
