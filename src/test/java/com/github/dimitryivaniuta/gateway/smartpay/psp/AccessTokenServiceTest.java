package com.github.dimitryivaniuta.gateway.smartpay.psp;

import com.github.dimitryivaniuta.gateway.smartpay.config.CacheConfig;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

/**
 * Caching behaviour of {@link AccessTokenService} with an in-memory cache in place of Redis.
 */
@SpringJUnitConfig
class AccessTokenServiceTest {

    @Configuration
    @EnableCaching
    static class Config {

        @Bean
        SmartPayGateway gateway() {
            return Mockito.mock(SmartPayGateway.class);
        }

        @Bean
        CacheManager cacheManager() {
            return new ConcurrentMapCacheManager(CacheConfig.ACCESS_TOKEN_CACHE);
        }

        @Bean
        AccessTokenService accessTokenService(SmartPayGateway gateway) {
            return new AccessTokenService(gateway);
        }
    }

    @Autowired
    SmartPayGateway gateway;

    @Autowired
    CacheManager cacheManager;

    @Autowired
    AccessTokenService tokens;

    @BeforeEach
    void reset() {
        Mockito.reset(gateway);
        cacheManager.getCache(CacheConfig.ACCESS_TOKEN_CACHE).clear();
        Mockito.when(gateway.refreshAccessToken(Mockito.anyString(), Mockito.any()))
                .thenReturn(new AccessToken("a1", "2030-01-01T00:00:00.000+01:00", 28_800_000L))
                .thenReturn(new AccessToken("a2", "2030-01-01T00:00:00.000+01:00", 28_800_000L));
    }

    @Test
    void tokenIsRefreshedOncePerRefreshTokenAndEnvironment() {
        Assertions.assertEquals("a1", tokens.accessToken("refresh", GatewayEnvironment.SANDBOX).token());
        Assertions.assertEquals("a1", tokens.accessToken("refresh", GatewayEnvironment.SANDBOX).token());
        Assertions.assertEquals("a2", tokens.accessToken("refresh", GatewayEnvironment.PRODUCTION).token());

        Mockito.verify(gateway, Mockito.times(2)).refreshAccessToken(Mockito.anyString(), Mockito.any());
    }

    @Test
    void evictedTokenIsRefreshedAgain() {
        tokens.accessToken("refresh", GatewayEnvironment.SANDBOX);
        tokens.evict("refresh", GatewayEnvironment.SANDBOX);

        Assertions.assertEquals("a2", tokens.accessToken("refresh", GatewayEnvironment.SANDBOX).token());
    }

    @Test
    void cacheKeyDoesNotContainTheRefreshToken() {
        tokens.accessToken("super-secret-refresh", GatewayEnvironment.SANDBOX);

        String key = "SANDBOX:" + AccessTokenService.fingerprint("super-secret-refresh");
        Assertions.assertNotNull(cacheManager.getCache(CacheConfig.ACCESS_TOKEN_CACHE).get(key));
        Assertions.assertEquals(32, AccessTokenService.fingerprint("super-secret-refresh").length());
        Assertions.assertFalse(key.contains("super-secret-refresh"));
    }
}
