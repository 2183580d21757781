package com.freelancerpro.backend.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Size- and time-bounded store for the statistics cache. Keys include the requested
 * date range, so entries are evicted by size and age as well as by mutations.
 */
@Configuration
public class CacheConfig {

    public static final String STATS_CACHE = "stats";

    @Bean
    public CacheManager cacheManager(FreelancerProperties properties) {
        FreelancerProperties.Cache cache = properties.cache();
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(STATS_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(cache.maxEntries())
                .expireAfterWrite(cache.ttl()));
        return cacheManager;
    }
}
