package personal.appointment.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.appointment.scheduling.booking.domain.model.OutboxEvent;
import personal.appointment.scheduling.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        return jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent)).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents(int maxRetryCount, int batchSize) {
        return jpaOutboxEventRepository.findByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
                        OutboxEventStatus.PENDING,
                        maxRetryCount,
                        PageRequest.of(0, batchSize))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
