package com.policywatch.ingest.polish;

import com.fasterxml.jackson.databind.JsonNode;
import com.policywatch.ingest.config.IngesterProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions endpoint.
 */
public class OpenAiPolishClient implements PolishProvider {

    static final String SYSTEM_PROMPT = "Rewrite the draft into a clear, neutral summary for policy analysts. "
            + "Preserve facts. Use 2-4 sentences. No bullets. No opinions.";

    private static final int MAX_DRAFT_CHARS = 2000;

    private final RestTemplate restTemplate;
    private final IngesterProperties.Polish.OpenAi settings;

    public OpenAiPolishClient(RestTemplate restTemplate, IngesterProperties.Polish.OpenAi settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "openai:" + settings.getModel();
    }

    @Override
    public String rewrite(String draft, String title, String url) {
        String clipped = draft.length() > MAX_DRAFT_CHARS ? draft.substring(0, MAX_DRAFT_CHARS) : draft;
        Map<String, Object> body = Map.of(
                "model", settings.getModel(),
                "temperature", 0.2,
                "max_tokens", 160,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content",
                                "TITLE: " + nullToEmpty(title) + "\nURL: " + nullToEmpty(url)
                                        + "\n\nDRAFT SUMMARY:\n" + clipped)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());

        JsonNode response = restTemplate.postForObject(
                trimSlash(settings.getBaseUrl()) + "/chat/completions",
                new HttpEntity<>(body, headers),
                JsonNode.class);
        if (response == null) {
            throw new IllegalStateException("Empty response from " + name());
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : "";
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
