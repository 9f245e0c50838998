package com.github.dimitryivaniuta.gateway.smartpay.repo;

import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentStatusLogEntry;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link PaymentStatusLogEntry}. Insert-only in application code.
 */
public interface PaymentStatusLogRepository extends JpaRepository<PaymentStatusLogEntry, String> {

    List<PaymentStatusLogEntry> findByOrderIdOrderByCreatedAtAsc(String orderId);
}
