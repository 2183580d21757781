package com.freelancerpro.backend.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "freelancer")
public record FreelancerProperties(Cors cors, Savings savings, Cache cache) {

    public FreelancerProperties {
        if (cors == null) {
            cors = new Cors(null);
        }
        if (savings == null) {
            savings = new Savings(null);
        }
        if (cache == null) {
            cache = new Cache(null, null);
        }
    }

    public record Cors(List<String> allowedOrigins) {
        public Cors {
            if (allowedOrigins == null) {
                allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
            }
        }
    }

    /**
     * @param expiringSoonDays look-ahead window used by the savings statistics
     */
    public record Savings(Integer expiringSoonDays) {
        public Savings {
            if (expiringSoonDays == null) {
                expiringSoonDays = 7;
            }
        }
    }

    /**
     * @param maxEntries upper bound on cached statistics results across all users
     * @param ttl        how long a cached result may be served before it is recomputed
     */
    public record Cache(Long maxEntries, Duration ttl) {
        public Cache {
            if (maxEntries == null) {
                maxEntries = 1000L;
            }
            if (ttl == null) {
                ttl = Duration.ofMinutes(10);
            }
        }
    }
}
