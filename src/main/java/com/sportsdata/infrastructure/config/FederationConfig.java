package com.sportsdata.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.application.federation.ProviderFederator;
import com.sportsdata.application.federation.ProviderRegistration;
import com.sportsdata.domain.ports.Operation;
import com.sportsdata.domain.ports.SportsDataProvider;
import com.sportsdata.infrastructure.cache.CacheTtlPolicy;
import com.sportsdata.infrastructure.cache.ProviderResultCache;
import com.sportsdata.infrastructure.config.FederationProperties.ProviderSettings;
import com.sportsdata.infrastructure.provider.HttpJsonFetcher;
import com.sportsdata.infrastructure.provider.espn.EspnClient;
import com.sportsdata.infrastructure.provider.espn.EspnLeague;
import com.sportsdata.infrastructure.provider.espn.EspnNormalizer;
import com.sportsdata.infrastructure.provider.espn.EspnProvider;
import com.sportsdata.infrastructure.provider.tsdb.TheSportsDbClient;
import com.sportsdata.infrastructure.provider.tsdb.TheSportsDbLeague;
import com.sportsdata.infrastructure.provider.tsdb.TheSportsDbNormalizer;
import com.sportsdata.infrastructure.provider.tsdb.TheSportsDbProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Wires providers, cache and federation from {@link FederationProperties}.
 */
@Configuration
@EnableConfigurationProperties(FederationProperties.class)
public class FederationConfig {

    private static final Logger logger = LoggerFactory.getLogger(FederationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId federationZone(FederationProperties properties) {
        return ZoneId.of(properties.getZone());
    }

    @Bean
    public EspnProvider espnProvider(FederationProperties properties, ObjectMapper objectMapper,
                                     ZoneId federationZone, Clock clock) {
        ProviderSettings settings = properties.provider(EspnNormalizer.PROVIDER_NAME);
        HttpJsonFetcher fetcher = new HttpJsonFetcher(EspnNormalizer.PROVIDER_NAME, objectMapper,
            settings.getRequestTimeout());
        EspnClient client = new EspnClient(fetcher,
            orDefault(settings.getBaseUrl(), EspnClient.DEFAULT_SITE_URL),
            orDefault(settings.getStandingsUrl(), EspnClient.DEFAULT_STANDINGS_URL));
        return new EspnProvider(client, new EspnNormalizer(), EspnLeague.DEFAULTS, federationZone, clock);
    }

    @Bean
    public TheSportsDbProvider theSportsDbProvider(FederationProperties properties, ObjectMapper objectMapper,
                                                   ZoneId federationZone, Clock clock) {
        ProviderSettings settings = properties.provider(TheSportsDbNormalizer.PROVIDER_NAME);
        HttpJsonFetcher fetcher = new HttpJsonFetcher(TheSportsDbNormalizer.PROVIDER_NAME, objectMapper,
            settings.getRequestTimeout());
        TheSportsDbClient client = new TheSportsDbClient(fetcher,
            orDefault(settings.getBaseUrl(), TheSportsDbClient.DEFAULT_BASE_URL),
            orDefault(settings.getApiKey(), TheSportsDbClient.DEFAULT_API_KEY));
        return new TheSportsDbProvider(client, new TheSportsDbNormalizer(), TheSportsDbLeague.DEFAULTS,
            federationZone, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService federationExecutor(FederationProperties properties) {
        return Executors.newFixedThreadPool(Math.max(properties.getWorkerThreads(), 2));
    }

    @Bean
    public ProviderResultCache providerResultCache(FederationProperties properties) {
        return new ProviderResultCache(properties.getCacheMaxSize());
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(FederationProperties properties, ZoneId federationZone, Clock clock) {
        return new CacheTtlPolicy(properties.ttlDurations(), federationZone, clock);
    }

    @Bean
    public ProviderFederator providerFederator(List<SportsDataProvider> providers, FederationProperties properties,
                                               ProviderResultCache providerResultCache, CacheTtlPolicy cacheTtlPolicy,
                                               ExecutorService federationExecutor) {
        Set<Operation> mergeable = properties.getMerge().stream()
            .map(Operation::fromKey)
            .collect(Collectors.toSet());
        return new ProviderFederator(registrations(providers, properties), providerResultCache, cacheTtlPolicy,
            federationExecutor, properties.getTimeout(), mergeable);
    }

    static List<ProviderRegistration> registrations(List<SportsDataProvider> providers,
                                                    FederationProperties properties) {
        List<ProviderRegistration> registrations = new ArrayList<>();
        for (SportsDataProvider provider : providers) {
            ProviderSettings settings = properties.provider(provider.name());
            if (!settings.isEnabled()) {
                logger.info("Provider {} is disabled", provider.name());
                continue;
            }
            registrations.add(new ProviderRegistration(provider, settings.getPriority()));
        }
        return registrations;
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
