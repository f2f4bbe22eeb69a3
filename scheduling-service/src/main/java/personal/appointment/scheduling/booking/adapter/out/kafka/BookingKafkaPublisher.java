package personal.appointment.scheduling.booking.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.booking.application.port.out.BookingEventPublisher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Booking Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예약 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 브로커 응답까지 기다려 실패 시 재시도 대상이 되도록 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingKafkaPublisher implements BookingEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Kafka publish interrupted: topic=" + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Kafka publish failed: topic=" + topic, e);
        }
    }
}
