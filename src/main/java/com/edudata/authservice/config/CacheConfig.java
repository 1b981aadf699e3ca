package com.edudata.authservice.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String USERS_BY_ID = "usersById";

    /**
     * Caffeine-backed CacheManager:
     * - Capacity: 10k
     * - TTL: 5 minutes, so profile changes show up on /auth/me without explicit eviction
     */
    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager mgr = new CaffeineCacheManager();
        mgr.setCaffeine(
                Caffeine.newBuilder()
                        .maximumSize(10_000)
                        .expireAfterWrite(Duration.ofMinutes(5))
                        .recordStats()
        );
        mgr.setCacheNames(List.of(USERS_BY_ID));
        mgr.setAllowNullValues(false);
        return mgr;
    }

    /**
     * Cache problems are logged and the lookup falls through to the database.
     */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key) {
                log.warn("Cache GET error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCachePutError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key,
                                            @Nullable Object value) {
                log.warn("Cache PUT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheEvictError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache,
                                              @NonNull Object key) {
                log.warn("Cache EVICT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheClearError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache) {
                log.warn("Cache CLEAR error on {}: {}", cache.getName(), exception.toString());
            }
        };
    }
}
