package com.policywatch.ingest.config;

import com.policywatch.ingest.adapter.AdapterType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "policy-ingester")
@Data
public class IngesterProperties {

    private Scheduling scheduling = new Scheduling();
    private Http http = new Http();
    private Summary summary = new Summary();
    private Polish polish = new Polish();
    private Journal journal = new Journal();
    private Repair repair = new Repair();
    private List<SourceDefinition> sources = new ArrayList<>();

    public Optional<SourceDefinition> findSource(String name) {
        return sources.stream()
                .filter(s -> s.getName() != null && s.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 */6 * * *";
        private boolean runOnStartup = false;
        private int defaultLimit = 0;
        private int defaultMaxPages = 0;
        private int maxConcurrentSources = 4;
        private int backfillMaxPagesSafety = 500;
    }

    @Data
    public static class Http {
        private long connectTimeoutMs = 15_000;
        private long readTimeoutMs = 45_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 1_500;
        private long maxBackoffMs = 6_000;
        private int maxBodyBytes = 15 * 1024 * 1024;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";
    }

    @Data
    public static class Summary {
        private int maxSentences = 3;
        private int maxChars = 700;
        private int shortTextSentences = 5;
        private int maxInputChars = 20_000;
        private int textrankIterations = 20;
        private double damping = 0.85;
    }

    @Data
    public static class Polish {
        private Provider provider = Provider.NONE;
        private int dailyBudget = 200;
        private long timeoutMs = 12_000;
        private int minLength = 40;
        private OpenAi openai = new OpenAi();
        private HuggingFace huggingFace = new HuggingFace();

        public enum Provider {
            OPENAI, HUGGING_FACE, NONE
        }

        @Data
        public static class OpenAi {
            private String apiKey;
            private String model = "gpt-4.1-mini";
            private String baseUrl = "https://api.openai.com/v1";
        }

        @Data
        public static class HuggingFace {
            private String token;
            private String model = "sshleifer/distilbart-cnn-12-6";
            private String baseUrl = "https://router.huggingface.co/hf-inference/models";
        }
    }

    /**
     * Batch that re-summarizes stored items whose summary is missing, too short, too long or still
     * starts with enacting boilerplate. Disabled on a schedule unless a cron is set.
     */
    @Data
    public static class Repair {
        private String cron = "-";
        private int batchLimit = 40;
        private int minLength = 140;
        private int maxLength = 700;
    }

    @Data
    public static class Journal {
        private JournalMode mode = JournalMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum JournalMode {
            DATABASE, CSV, BOTH
        }
    }

    /**
     * One configured source. Listing markup rules stay out of here: a source is described by
     * where its listing lives, which links are documents, and where history ends.
     */
    @Data
    public static class SourceDefinition {
        private String name;
        private String kind;
        private String baseUrl;
        private AdapterType adapter = AdapterType.LISTING;
        private String listingUrl;

        /** e.g. https://example.gov/news/page/{page}/ ; when unset, rel=next links are followed */
        private String pageUrlTemplate;

        /** Number substituted for {page} when requesting the second listing page */
        private int templateStartPage = 2;

        /** Regex a canonical detail URL must contain a match for */
        private String linkPattern;

        /** Oldest external id this source should ever ingest, inclusive */
        private String cutoffExternalId;

        private String jurisdiction;
        private String agency;
        private String status = "notice";

        /** Site name stripped from document titles and treated as a generic title */
        private String siteName;

        private int incrementalMaxPages = 3;
        private int incrementalMaxItems = 25;
        private boolean enabled = true;
    }
}
