package com.github.dimitryivaniuta.gateway.smartpay.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One encrypted credential of a PSP account (AES-GCM, Base64 ciphertext and IV).
 */
@Entity
@Table(
        name = "provider_secrets",
        uniqueConstraints = @UniqueConstraint(name = "uq_provider_secret_key", columnNames = {"provider_id", "secret_key"})
)
@Getter
@Setter
@NoArgsConstructor
public class ProviderSecret {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private Long providerId;

    @Column(name = "secret_key", nullable = false, updatable = false, length = 64)
    private String secretKey;

    @Column(name = "encrypted_value", nullable = false, columnDefinition = "text")
    private String encryptedValue;

    @Column(name = "iv", nullable = false, length = 32)
    private String iv;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Factory method.
     *
     * @param providerId     owning provider
     * @param secretKey      secret name
     * @param encryptedValue Base64 ciphertext
     * @param iv             Base64 IV
     * @return secret row
     */
    public static ProviderSecret of(Long providerId, String secretKey, String encryptedValue, String iv) {
        ProviderSecret s = new ProviderSecret();
        s.id = UUID.randomUUID().toString();
        s.providerId = providerId;
        s.secretKey = secretKey;
        s.encryptedValue = encryptedValue;
        s.iv = iv;
        s.updatedAt = Instant.now();
        return s;
    }
}
