package com.github.dimitryivaniuta.gateway.smartpay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Only PSP access tokens are cached. Refresh tokens and signing keys are never cached; they are
 * read and decrypted per request.</p>
 */
@EnableCaching
@Configuration
public class CacheConfig {

    /**
     * Cache name for PSP access tokens.
     */
    public static final String ACCESS_TOKEN_CACHE = "smartPayAccessToken";

    /**
     * Cache manager using Redis with JSON serialization; the TTL comes from {@code app.smart-pay.access-token-ttl}.
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @param props        application properties
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(
            RedisConnectionFactory factory,
            ObjectMapper objectMapper,
            AppProperties props
    ) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, AccessToken.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .disableCachingNullValues()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var accessTokenCfg = defaultCfg
                .entryTtl(props.getSmartPay().getAccessTokenTtl())
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(ACCESS_TOKEN_CACHE, accessTokenCfg)
                .build();
    }
}
