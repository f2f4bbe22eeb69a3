package personal.appointment.scheduling.booking.adapter.in.web.dto;

import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.Instant;

/**
 * 예약 조회/생성 응답 DTO
 */
public record AppointmentResponse(
        Long appointmentId,
        String subjectId,
        Instant slotStart,
        Instant slotEnd,
        AppointmentStatus status,
        Instant createdAt,
        Instant cancelledAt
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.id(),
                appointment.subjectId(),
                appointment.slotStart(),
                appointment.slotEnd(),
                appointment.status(),
                appointment.createdAt(),
                appointment.cancelledAt()
        );
    }
}
