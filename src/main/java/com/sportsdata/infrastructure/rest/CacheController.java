package com.sportsdata.infrastructure.rest;

import com.sportsdata.application.service.SportsDataService;
import com.sportsdata.infrastructure.cache.ProviderResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for cache inspection and invalidation.
 */
@RestController
@RequestMapping("/cache")
public class CacheController {

    private static final Logger logger = LoggerFactory.getLogger(CacheController.class);

    private final SportsDataService sportsDataService;

    public CacheController(SportsDataService sportsDataService) {
        this.sportsDataService = sportsDataService;
    }

    /**
     * GET /cache/stats
     *
     * @return cache statistics and provider failure counters
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatus> stats() {
        try {
            return ResponseEntity.ok(new CacheStatus(
                sportsDataService.providerNames(),
                sportsDataService.cacheStats(),
                sportsDataService.failureCounts()
            ));
        } catch (Exception e) {
            logger.error("Error reading cache statistics", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * POST /cache/refresh clears everything; POST /cache/refresh?provider=espn
     * drops only entries holding that provider's data.
     */
    @PostMapping("/refresh")
    public ResponseEntity<RefreshSummary> refresh(@RequestParam(name = "provider", required = false) String provider) {
        logger.info("Received request to refresh cache (provider: {})", provider != null ? provider : "all");

        try {
            if (provider == null || provider.isBlank()) {
                return ResponseEntity.ok(new RefreshSummary("all", sportsDataService.clearCache()));
            }
            if (!sportsDataService.providerNames().contains(provider)) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(new RefreshSummary(provider, sportsDataService.invalidateProvider(provider)));
        } catch (Exception e) {
            logger.error("Error refreshing cache", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    public record CacheStatus(List<String> providers, ProviderResultCache.Stats cache, Map<String, Long> failures) {}

    public record RefreshSummary(String scope, int invalidated) {}
}
