package personal.appointment.scheduling.booking.domain.model;

/**
 * 예약 상태
 * CONFIRMED -> CANCELLED (종료 상태)
 */
public enum AppointmentStatus {
    CONFIRMED,
    CANCELLED
}
