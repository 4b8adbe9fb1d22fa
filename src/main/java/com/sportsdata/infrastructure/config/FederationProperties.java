package com.sportsdata.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code sports.federation}.
 */
@ConfigurationProperties(prefix = "sports.federation")
public class FederationProperties {

    /** Budget for one federated call, fallbacks included. Bare numbers are seconds. */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(20);

    /** Zone in which request dates are interpreted. */
    private String zone = "America/New_York";

    private int workerThreads = 8;

    private long cacheMaxSize = 10_000;

    /** Operation keys answered by merging every provider. */
    private List<String> merge = List.of("league_teams");

    /**
     * Cache TTL overrides keyed by kebab-case name, e.g. {@code team-stats: 4h}
     * or {@code live: 30}. Bare numbers are seconds.
     */
    private Map<String, String> ttl = new LinkedHashMap<>();

    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(long cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public List<String> getMerge() {
        return merge;
    }

    public void setMerge(List<String> merge) {
        this.merge = merge;
    }

    public Map<String, String> getTtl() {
        return ttl;
    }

    public void setTtl(Map<String, String> ttl) {
        this.ttl = ttl;
    }

    /**
     * TTL overrides parsed as durations. Map values are bound as text because
     * {@link DurationUnit} is not applied to map entries.
     */
    public Map<String, Duration> ttlDurations() {
        Map<String, Duration> durations = new LinkedHashMap<>();
        ttl.forEach((key, value) -> {
            try {
                durations.put(key, DurationStyle.detectAndParse(value, ChronoUnit.SECONDS));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid sports.federation.ttl." + key + ": " + value, e);
            }
        });
        return durations;
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    /**
     * Settings for a provider, or defaults when it is not configured.
     */
    public ProviderSettings provider(String name) {
        return providers.getOrDefault(name, new ProviderSettings());
    }

    public static class ProviderSettings {

        private boolean enabled = true;
        private int priority = 100;
        private String baseUrl;
        private String standingsUrl;
        private String apiKey;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getStandingsUrl() {
            return standingsUrl;
        }

        public void setStandingsUrl(String standingsUrl) {
            this.standingsUrl = standingsUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
