package personal.appointment.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.booking.application.port.in.RelayPendingEventsUseCase;
import personal.appointment.scheduling.booking.application.port.out.BookingEventPublisher;
import personal.appointment.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.appointment.scheduling.booking.domain.model.BookingEventType;
import personal.appointment.scheduling.booking.domain.model.OutboxEvent;
import personal.appointment.scheduling.config.AppointmentProperties;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Booking Event Relay
 * Outbox의 예약 이벤트를 타입별 토픽으로 전달한다.
 * 같은 예약의 이벤트는 appointmentId를 키로 써서 파티션 내 순서를 유지한다.
 * 알 수 없는 타입은 재시도 없이 FAILED, 발행 실패는 설정된 한도까지 재시도 후 FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingEventRelay implements RelayPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final BookingEventPublisher eventPublisher;
    private final AppointmentProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public RelayResult relayPendingEvents() {
        AppointmentProperties.Outbox outbox = properties.outbox();
        List<OutboxEvent> batch = outboxEventRepository.findPendingEvents(outbox.maxRetryCount(), outbox.batchSize());
        if (batch.isEmpty()) {
            return RelayResult.EMPTY;
        }

        int published = 0;
        int retrying = 0;
        int failed = 0;
        for (OutboxEvent event : batch) {
            OutboxEvent next = relay(event, outbox.maxRetryCount());
            outboxEventRepository.save(next);
            switch (next.status()) {
                case PUBLISHED -> published++;
                case FAILED -> failed++;
                case PENDING -> retrying++;
            }
        }
        return new RelayResult(published, retrying, failed);
    }

    private OutboxEvent relay(OutboxEvent event, int maxRetryCount) {
        Optional<BookingEventType> type = BookingEventType.find(event.eventType());
        if (type.isEmpty()) {
            log.error("Unknown outbox event type, giving up: id={}, type={}", event.id(), event.eventType());
            return event.markAsFailed();
        }

        String topic = type.get().topic();
        try {
            eventPublisher.publishRaw(topic, String.valueOf(event.aggregateId()), event.payload());
            log.debug("Outbox event relayed: id={}, topic={}", event.id(), topic);
            return event.markAsPublished(clock.instant());
        } catch (RuntimeException e) {
            OutboxEvent failed = event.recordFailure(maxRetryCount);
            if (failed.isFailed()) {
                log.error("Outbox event exhausted retries: id={}, topic={}, attempts={}",
                        event.id(), topic, failed.retryCount(), e);
            } else {
                log.warn("Outbox event relay failed, will retry: id={}, topic={}, attempts={}/{}",
                        event.id(), topic, failed.retryCount(), maxRetryCount, e);
            }
            return failed;
        }
    }
}
