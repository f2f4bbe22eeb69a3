package personal.appointment.scheduling.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.BookingEventType;

/**
 * Outbox Event Factory (Adapter Layer)
 * Appointment를 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    static final String AGGREGATE_TYPE = "APPOINTMENT";

    private final ObjectMapper objectMapper;

    /**
     * 예약의 현재 상태에 대응하는 이벤트 (CONFIRMED -> BOOKING_CONFIRMED, CANCELLED -> BOOKING_CANCELLED)
     */
    public OutboxEventEntity create(Appointment appointment) {
        BookingEventType eventType = BookingEventType.of(appointment.status());
        BookingEvent event = new BookingEvent(
                appointment.id(),
                appointment.subjectId(),
                appointment.slotStart().toString(),
                appointment.slotEnd().toString(),
                appointment.status().name(),
                appointment.createdAt().toString(),
                appointment.cancelledAt() == null ? null : appointment.cancelledAt().toString());

        try {
            String payload = objectMapper.writeValueAsString(event);
            return OutboxEventEntity.create(AGGREGATE_TYPE, appointment.id(), eventType.name(), payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: appointmentId={}", appointment.id(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event");
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record BookingEvent(
            Long appointmentId,
            String subjectId,
            String slotStart,
            String slotEnd,
            String status,
            String createdAt,
            String cancelledAt) {
    }
}
