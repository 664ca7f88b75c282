package com.williamcallahan.lawlens.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings bound from the {@code app.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Retrieval retrieval = new Retrieval();
    private Viewer viewer = new Viewer();
    private Cors cors = new Cors();

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(Retrieval retrieval) {
        this.retrieval = retrieval;
    }

    public Viewer getViewer() {
        return viewer;
    }

    public void setViewer(Viewer viewer) {
        this.viewer = viewer;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors;
    }

    /**
     * Rejects settings that would make the retrieval cache or viewer registry unusable.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(retrieval.getFetchTimeout(), "app.retrieval.fetch-timeout");
        requirePositive(retrieval.getCacheTtl(), "app.retrieval.cache-ttl");
        requirePositive(viewer.getSessionTtl(), "app.viewer.session-ttl");
        if (retrieval.getCacheSize() <= 0) {
            throw new IllegalArgumentException("app.retrieval.cache-size must be positive");
        }
        if (viewer.getMaxSessions() <= 0) {
            throw new IllegalArgumentException("app.viewer.max-sessions must be positive");
        }
        if (retrieval.getBaseUrl() == null || retrieval.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("app.retrieval.base-url is required");
        }
    }

    private static void requirePositive(Duration duration, String propertyName) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(propertyName + " must be a positive duration");
        }
    }

    /**
     * Document back end used to expand cited excerpts.
     */
    public static class Retrieval {
        private String baseUrl = "http://localhost:8000";
        private Duration fetchTimeout = Duration.ofSeconds(8);
        private long cacheSize = 500;
        private Duration cacheTtl = Duration.ofMinutes(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public long getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(long cacheSize) {
            this.cacheSize = cacheSize;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    /**
     * Citation viewer session registry.
     */
    public static class Viewer {
        private Duration sessionTtl = Duration.ofMinutes(30);
        private long maxSessions = 10_000;

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }

        public long getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(long maxSessions) {
            this.maxSessions = maxSessions;
        }
    }

    /**
     * CORS rules for the {@code /api/**} endpoints.
     */
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        private List<String> allowedHeaders = new ArrayList<>(List.of("*"));
        private boolean allowCredentials = false;
        private long maxAgeSeconds = 3600;

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public List<String> getAllowedMethods() {
            return allowedMethods;
        }

        public void setAllowedMethods(List<String> allowedMethods) {
            this.allowedMethods = allowedMethods;
        }

        public List<String> getAllowedHeaders() {
            return allowedHeaders;
        }

        public void setAllowedHeaders(List<String> allowedHeaders) {
            this.allowedHeaders = allowedHeaders;
        }

        public boolean isAllowCredentials() {
            return allowCredentials;
        }

        public void setAllowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
        }

        public long getMaxAgeSeconds() {
            return maxAgeSeconds;
        }

        public void setMaxAgeSeconds(long maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
        }
    }
}
