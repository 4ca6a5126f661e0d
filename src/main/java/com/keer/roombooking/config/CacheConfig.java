package com.keer.roombooking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.time.Duration;
import java.util.Map;

@Configuration
@ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
public class CacheConfig {

    public static final String ROOMS_CACHE = "rooms";

    private final Duration defaultTtl;
    private final Duration roomsTtl;

    public CacheConfig(@Value("${booking.cache.default-ttl:PT30S}") Duration defaultTtl,
                       @Value("${booking.cache.rooms-ttl:PT10M}") Duration roomsTtl) {
        this.defaultTtl = defaultTtl;
        this.roomsTtl = roomsTtl;
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(entryConfiguration(defaultTtl))
                .withInitialCacheConfigurations(cacheConfigurations())
                .transactionAware()
                .build();
    }

    // Room entries are evicted on every update, so they can outlive the default.
    Map<String, RedisCacheConfiguration> cacheConfigurations() {
        return Map.of(ROOMS_CACHE, entryConfiguration(roomsTtl));
    }

    RedisCacheConfiguration entryConfiguration(Duration ttl) {
        return RedisCacheConfiguration.defaultCacheConfig()
                .prefixCacheNameWith("roombooking::")
                .serializeValuesWith(RedisSerializationContext.SerializationPair
                        .fromSerializer(new GenericJackson2JsonRedisSerializer()))
                .entryTtl(ttl)
                .disableCachingNullValues();
    }
}
