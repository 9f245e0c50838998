package com.github.dimitryivaniuta.gateway.smartpay.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A configured PSP account: the store URLs the customer and relay calls are sent to.
 *
 * <p>Credentials live in {@link ProviderSecret} rows, encrypted.</p>
 */
@Entity
@Table(name = "payment_service_providers")
@Getter
@Setter
@NoArgsConstructor
public class PaymentServiceProvider {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 128)
    private String title;

    @Column(name = "success_url", nullable = false, length = 1024)
    private String successUrl;

    @Column(name = "fail_url", nullable = false, length = 1024)
    private String failUrl;

    @Column(name = "pending_url", length = 1024)
    private String pendingUrl;

    /**
     * Where the PSP sends the browser back to; falls back to the success URL.
     */
    @Column(name = "return_url", length = 1024)
    private String returnUrl;

    /**
     * Store callback receiving relayed status updates.
     */
    @Column(name = "webhook_url", length = 1024)
    private String webhookUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /**
     * Factory method.
     *
     * @param id         provider id
     * @param title      display title
     * @param successUrl success URL
     * @param failUrl    fail URL
     * @return provider
     */
    public static PaymentServiceProvider of(Long id, String title, String successUrl, String failUrl) {
        PaymentServiceProvider p = new PaymentServiceProvider();
        p.id = id;
        p.title = title;
        p.successUrl = successUrl;
        p.failUrl = failUrl;
        p.createdAt = Instant.now();
        return p;
    }
}
