package com.salesagent.leads.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "lead-pipeline")
@Data
public class LeadPipelineProperties {

    private Search search = new Search();
    private Ingestion ingestion = new Ingestion();
    private Retrieval retrieval = new Retrieval();
    private Pipeline pipeline = new Pipeline();
    private Llm llm = new Llm();
    private Calling calling = new Calling();
    private Mail mail = new Mail();
    private Meeting meeting = new Meeting();
    private Scheduling scheduling = new Scheduling();
    private Http http = new Http();

    @Data
    public static class Search {
        private Foursquare foursquare = new Foursquare();
        private Osm osm = new Osm();

        @Data
        public static class Foursquare {
            private boolean enabled = true;
            private String baseUrl = "https://places-api.foursquare.com";
            private String apiKey;
            private String apiVersion = "2025-06-17";
            private int maxLimit = 50;
        }

        @Data
        public static class Osm {
            private boolean enabled = true;
            private String nominatimUrl = "https://nominatim.openstreetmap.org";
            private String overpassUrl = "https://overpass-api.de/api/interpreter";
            private String userAgent = "sales-agent/1.0";
        }
    }

    @Data
    public static class Ingestion {
        private Duration verifyPollInterval = Duration.ofSeconds(1);
        private Duration verifyMaxWait = Duration.ofSeconds(30);
        private int casMaxAttempts = 5;
    }

    @Data
    public static class Retrieval {
        private int maxAttempts = 5;
        private Duration backoff = Duration.ofSeconds(1);
        private int defaultLimit = 10;
    }

    @Data
    public static class Pipeline {
        private int fanOut = 3;
        private Duration stageTimeout = Duration.ofMinutes(2);
        private Duration callTimeout = Duration.ofMinutes(5);
        private Duration leadTimeout = Duration.ofMinutes(10);
        private boolean proceedOnUnverified = false;
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.cerebras.ai/v1";
        private String apiKey;
        private String model = "llama3.3-70b";
        private double temperature = 0.3;
        private int maxTokens = 1200;
    }

    @Data
    public static class Calling {
        private String baseUrl = "https://api.elevenlabs.io";
        private String apiKey;
        private String agentId;
        private String phoneNumberId;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int maxPolls = 240;
    }

    @Data
    public static class Mail {
        private String relayUrl;
        private String apiKey;
        private String fromAddress = "outreach@example.com";
        private String subject = "A proposal for {name}";
    }

    @Data
    public static class Meeting {
        private String titleTemplate = "Intro call with {name}";
        private int durationMinutes = 30;
        private int startHour = 10;
        private String zone = "UTC";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 9 * * MON-FRI";
        private boolean runOnStartup = false;
        private String query = "restaurants";
        private String location = "New York";
        private int radiusMeters = 2000;
        private int limit = 10;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
