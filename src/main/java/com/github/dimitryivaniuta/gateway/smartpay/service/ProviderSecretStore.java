package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.domain.ProviderSecret;
import com.github.dimitryivaniuta.gateway.smartpay.repo.ProviderSecretRepository;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * PSP credentials stored AES-GCM encrypted in {@code provider_secrets}, decrypted on every read.
 */
@Component
public class ProviderSecretStore {

    private static final Logger log = LoggerFactory.getLogger(ProviderSecretStore.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int IV_BYTES = 12;

    private final ProviderSecretRepository repository;
    private final SecretKeySpec encryptionKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public ProviderSecretStore(ProviderSecretRepository repository, AppProperties props) {
        this.repository = repository;
        String encoded = props.getSecrets().getEncryptionKey();
        this.encryptionKey = encoded == null || encoded.isBlank()
                ? null
                : new SecretKeySpec(Base64.getDecoder().decode(encoded), "AES");
    }

    @PostConstruct
    void validateKey() {
        if (encryptionKey == null) {
            log.warn("app.secrets.encryption-key is not set; PSP credentials cannot be read or stored");
            return;
        }
        if (encryptionKey.getEncoded().length != 32) {
            throw new IllegalStateException("app.secrets.encryption-key must be a Base64-encoded 256-bit key, got "
                    + encryptionKey.getEncoded().length + " bytes");
        }
    }

    /**
     * Encrypts and stores a secret, replacing an existing value.
     *
     * @param providerId provider id
     * @param secretKey  secret name
     * @param plaintext  secret value
     */
    @Transactional
    public void store(Long providerId, String secretKey, String plaintext) {
        byte[] iv = new byte[IV_BYTES];
        secureRandom.nextBytes(iv);
        String ciphertext = Base64.getEncoder().encodeToString(
                cipher(Cipher.ENCRYPT_MODE, iv, plaintext.getBytes(StandardCharsets.UTF_8)));
        String encodedIv = Base64.getEncoder().encodeToString(iv);

        ProviderSecret secret = repository.findByProviderIdAndSecretKey(providerId, secretKey)
                .map(existing -> {
                    existing.setEncryptedValue(ciphertext);
                    existing.setIv(encodedIv);
                    existing.setUpdatedAt(Instant.now());
                    return existing;
                })
                .orElseGet(() -> ProviderSecret.of(providerId, secretKey, ciphertext, encodedIv));
        repository.save(secret);
    }

    /**
     * Reads and decrypts a secret.
     *
     * @param providerId provider id
     * @param secretKey  secret name
     * @return plaintext, empty when no row exists
     */
    @Transactional(readOnly = true)
    public Optional<String> find(Long providerId, String secretKey) {
        return repository.findByProviderIdAndSecretKey(providerId, secretKey)
                .map(secret -> new String(
                        cipher(Cipher.DECRYPT_MODE,
                                Base64.getDecoder().decode(secret.getIv()),
                                Base64.getDecoder().decode(secret.getEncryptedValue())),
                        StandardCharsets.UTF_8));
    }

    private byte[] cipher(int mode, byte[] iv, byte[] input) {
        if (encryptionKey == null) {
            throw new IllegalStateException("app.secrets.encryption-key is not configured");
        }
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(mode, encryptionKey, new GCMParameterSpec(GCM_TAG_BITS, iv));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(mode == Cipher.ENCRYPT_MODE ? "Encryption failed" : "Decryption failed", e);
        }
    }
}
