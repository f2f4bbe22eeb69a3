package personal.appointment.scheduling.booking.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import personal.appointment.scheduling.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    List<OutboxEventEntity> findByAggregateTypeAndAggregateId(String aggregateType, Long aggregateId);

    /**
     * 발행 대기 중인 이벤트 조회 (재시도 횟수 제한, 배치 크기는 Pageable)
     */
    List<OutboxEventEntity> findByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
            OutboxEventStatus status,
            int maxRetryCount,
            Pageable pageable
    );
}
