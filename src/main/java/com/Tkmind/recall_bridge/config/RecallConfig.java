package com.Tkmind.recall_bridge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@ConfigurationProperties(prefix = "recall")
@Getter
@Setter
public class RecallConfig {

    private Api api = new Api();
    private Bot bot = new Bot();
    private Polling polling = new Polling();

    @Getter
    @Setter
    public static class Api {
        private String region = "us-east-1";

        /**
         * Overrides the region-derived endpoint. Leave blank to use
         * https://{region}.recall.ai/api/v1.
         */
        private String baseUrl;

        private String apiKey;

        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 15_000;

        public String resolveBaseUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) {
                return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            }
            return "https://" + region + ".recall.ai/api/v1";
        }
    }

    @Getter
    @Setter
    public static class Bot {
        /** Prefix of every bot display name: "{appName} Bot - {meeting title}". */
        private String appName = "JumpApp";
        private int defaultJoinMinutesBefore = 2;
    }

    @Getter
    @Setter
    public static class Polling {
        private long intervalMs = 30_000L;
        private boolean autoStart = true;
    }

    @Bean
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(api.getConnectTimeoutMs());
        factory.setReadTimeout(api.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
