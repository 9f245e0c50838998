package com.github.dimitryivaniuta.gateway.smartpay.repo;

import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentServiceProvider;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link PaymentServiceProvider}.
 */
public interface PaymentServiceProviderRepository extends JpaRepository<PaymentServiceProvider, Long> {
}
