package personal.appointment.scheduling.booking.application.port.out;

import personal.appointment.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * retryCount < maxRetryCount 인 PENDING 이벤트를 생성 순으로 최대 batchSize건
     */
    List<OutboxEvent> findPendingEvents(int maxRetryCount, int batchSize);
}
