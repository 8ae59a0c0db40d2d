package com.policywatch.ingest.config;

import com.policywatch.ingest.polish.HuggingFacePolishClient;
import com.policywatch.ingest.polish.OpenAiPolishClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;

class PolishConfigTest {

    private final RestTemplate restTemplate = new RestTemplate();

    @Test
    @DisplayName("Configured provider with credentials is selected")
    void selectsConfiguredProvider() {
        IngesterProperties.Polish polish = new IngesterProperties.Polish();
        polish.setProvider(IngesterProperties.Polish.Provider.OPENAI);
        polish.getOpenai().setApiKey("sk-test");
        assertThat(PolishConfig.selectProvider(polish, restTemplate)).isInstanceOf(OpenAiPolishClient.class);

        polish.setProvider(IngesterProperties.Polish.Provider.HUGGING_FACE);
        polish.getHuggingFace().setToken("hf-test");
        assertThat(PolishConfig.selectProvider(polish, restTemplate)).isInstanceOf(HuggingFacePolishClient.class);
    }

    @Test
    @DisplayName("Missing credentials disable polishing instead of falling back")
    void missingCredentials() {
        IngesterProperties.Polish polish = new IngesterProperties.Polish();
        polish.setProvider(IngesterProperties.Polish.Provider.OPENAI);
        polish.getHuggingFace().setToken("hf-test");

        assertThat(PolishConfig.selectProvider(polish, restTemplate)).isNull();
    }

    @Test
    @DisplayName("NONE selects nothing")
    void none() {
        assertThat(PolishConfig.selectProvider(new IngesterProperties.Polish(), restTemplate)).isNull();
    }
}
