package com.github.dimitryivaniuta.guard.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.dedup.InFlightEntry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-flight dedup map backed by Caffeine.
 *
 * Entries are removed explicitly when their call settles; the size bound and the write TTL only
 * catch leaks. {@link UpstreamGuardProperties} guarantees both outlast any live entry.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, InFlightEntry> inFlightRequests(UpstreamGuardProperties props) {
        return Caffeine.newBuilder()
                .maximumSize(props.getMaxInFlightEntries())
                .expireAfterWrite(props.getInFlightTtl())
                .build();
    }
}
