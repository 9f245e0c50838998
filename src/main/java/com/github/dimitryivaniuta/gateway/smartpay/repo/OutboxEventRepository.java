package com.github.dimitryivaniuta.gateway.smartpay.repo;

import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link OutboxEvent}.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Locks the next due status events, skipping rows another dispatcher instance holds.
     *
     * @param statuses statuses to pick up (NEW, RETRY)
     * @param now      current time
     * @param limit    batch size
     * @return locked batch, oldest first
     */
    @Query(value = """
            select *
            from status_outbox_events
            where status in (:statuses)
              and (next_attempt_at is null or next_attempt_at <= :now)
            order by created_at
            for update skip locked
            limit :limit
            """, nativeQuery = true)
    List<OutboxEvent> lockDueBatch(
            @Param("statuses") List<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    long countByStatus(OutboxStatus status);
}
