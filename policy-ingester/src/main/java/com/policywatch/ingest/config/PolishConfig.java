package com.policywatch.ingest.config;

import com.policywatch.ingest.polish.BudgetState;
import com.policywatch.ingest.polish.HuggingFacePolishClient;
import com.policywatch.ingest.polish.OpenAiPolishClient;
import com.policywatch.ingest.polish.PolishGate;
import com.policywatch.ingest.polish.PolishProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Picks the single polish provider for the lifetime of the process.
 */
@Configuration
@Slf4j
public class PolishConfig {

    @Bean
    public BudgetState polishBudget(IngesterProperties properties, Clock clock) {
        return new BudgetState(properties.getPolish().getDailyBudget(), clock);
    }

    @Bean
    public PolishGate polishGate(IngesterProperties properties,
                                 BudgetState polishBudget,
                                 @Qualifier("polishRestTemplate") RestTemplate restTemplate,
                                 @Qualifier("polishExecutor") ThreadPoolTaskExecutor polishExecutor) {
        IngesterProperties.Polish polish = properties.getPolish();
        PolishProvider provider = selectProvider(polish, restTemplate);
        log.info("Summary polish provider: {} (daily budget {})",
                provider == null ? "none" : provider.name(),
                polish.getDailyBudget() <= 0 ? "unlimited" : polish.getDailyBudget());
        return new PolishGate(provider, polishBudget, Duration.ofMillis(polish.getTimeoutMs()),
                polish.getMinLength(), polishExecutor);
    }

    static PolishProvider selectProvider(IngesterProperties.Polish polish, RestTemplate restTemplate) {
        switch (polish.getProvider()) {
            case OPENAI -> {
                if (hasText(polish.getOpenai().getApiKey())) {
                    return new OpenAiPolishClient(restTemplate, polish.getOpenai());
                }
                log.info("OPENAI polish selected but no API key configured; polishing disabled");
                return null;
            }
            case HUGGING_FACE -> {
                if (hasText(polish.getHuggingFace().getToken())) {
                    return new HuggingFacePolishClient(restTemplate, polish.getHuggingFace());
                }
                log.info("HUGGING_FACE polish selected but no token configured; polishing disabled");
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
