package personal.appointment.scheduling.booking.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 예약 이벤트 타입과 발행 토픽
 */
public enum BookingEventType {
    BOOKING_CONFIRMED("appointment.booking.confirmed"),
    BOOKING_CANCELLED("appointment.booking.cancelled");

    private final String topic;

    BookingEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }

    public static BookingEventType of(AppointmentStatus status) {
        return switch (status) {
            case CONFIRMED -> BOOKING_CONFIRMED;
            case CANCELLED -> BOOKING_CANCELLED;
        };
    }

    /**
     * Outbox에 저장된 문자열 타입 해석. 모르는 값이면 empty
     */
    public static Optional<BookingEventType> find(String eventType) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(eventType))
                .findFirst();
    }
}
