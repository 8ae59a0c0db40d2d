package com.policywatch.ingest.polish;

import com.fasterxml.jackson.databind.JsonNode;
import com.policywatch.ingest.config.IngesterProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Hugging Face hosted inference for seq2seq summarization models. These models take raw text,
 * not instructions, so the input is just the title followed by the draft.
 */
public class HuggingFacePolishClient implements PolishProvider {

    private final RestTemplate restTemplate;
    private final IngesterProperties.Polish.HuggingFace settings;

    public HuggingFacePolishClient(RestTemplate restTemplate, IngesterProperties.Polish.HuggingFace settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "huggingface:" + settings.getModel();
    }

    @Override
    public String rewrite(String draft, String title, String url) {
        String input = title == null || title.isBlank() ? draft.strip() : title.strip() + ". " + draft.strip();
        Map<String, Object> body = Map.of(
                "inputs", input,
                "parameters", Map.of(
                        "min_length", 40,
                        "max_length", 120,
                        "do_sample", false,
                        "repetition_penalty", 1.05),
                "options", Map.of("wait_for_model", true, "use_cache", true));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getToken());

        String base = settings.getBaseUrl().endsWith("/") ? settings.getBaseUrl() : settings.getBaseUrl() + "/";
        JsonNode response = restTemplate.postForObject(base + settings.getModel(),
                new HttpEntity<>(body, headers), JsonNode.class);
        if (response == null || !response.isArray() || response.isEmpty()) {
            throw new IllegalStateException("Unexpected response from " + name());
        }
        JsonNode first = response.get(0);
        if (first.hasNonNull("summary_text")) {
            return first.get("summary_text").asText();
        }
        return first.path("generated_text").asText("");
    }
}
