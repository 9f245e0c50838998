package com.github.dimitryivaniuta.gateway.smartpay.psp;

import com.github.dimitryivaniuta.gateway.smartpay.config.CacheConfig;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Caches PSP access tokens per environment and refresh token.
 *
 * <p>The cache key holds a SHA-256 fingerprint of the refresh token, never the token itself.</p>
 */
@Service
public class AccessTokenService {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);

    private static final String KEY =
            "#environment.name() + ':' + T(com.github.dimitryivaniuta.gateway.smartpay.psp.AccessTokenService).fingerprint(#refreshToken)";

    private final SmartPayGateway gateway;

    public AccessTokenService(SmartPayGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Returns a cached access token, refreshing it at the PSP on a miss.
     *
     * @param refreshToken refresh token
     * @param environment  gateway environment
     * @return access token
     */
    @Cacheable(cacheNames = CacheConfig.ACCESS_TOKEN_CACHE, key = KEY)
    public AccessToken accessToken(String refreshToken, GatewayEnvironment environment) {
        log.info("Access token cache miss; refreshing. environment={}", environment);
        return gateway.refreshAccessToken(refreshToken, environment);
    }

    /**
     * Drops the cached token after the PSP rejected it.
     *
     * @param refreshToken refresh token the access token was obtained with
     * @param environment  gateway environment
     */
    @CacheEvict(cacheNames = CacheConfig.ACCESS_TOKEN_CACHE, key = KEY)
    public void evict(String refreshToken, GatewayEnvironment environment) {
        log.info("Evicted access token. environment={}", environment);
    }

    /**
     * Stable, non-reversible identifier of a refresh token.
     *
     * @param refreshToken refresh token
     * @return first 32 hex chars of its SHA-256 digest
     */
    public static String fingerprint(String refreshToken) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(refreshToken.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
