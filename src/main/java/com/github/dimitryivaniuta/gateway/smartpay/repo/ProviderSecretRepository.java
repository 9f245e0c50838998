package com.github.dimitryivaniuta.gateway.smartpay.repo;

import com.github.dimitryivaniuta.gateway.smartpay.domain.ProviderSecret;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link ProviderSecret}.
 */
public interface ProviderSecretRepository extends JpaRepository<ProviderSecret, String> {

    Optional<ProviderSecret> findByProviderIdAndSecretKey(Long providerId, String secretKey);
}
