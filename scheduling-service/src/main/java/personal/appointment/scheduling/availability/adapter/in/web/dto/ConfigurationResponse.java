package personal.appointment.scheduling.availability.adapter.in.web.dto;

import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

import java.time.Instant;

/**
 * 전역 예약 설정 응답 DTO
 */
public record ConfigurationResponse(
        int slotDurationMinutes,
        int maxAppointmentsPerSlot,
        String timezone,
        int minBookingLeadMinutes,
        Instant updatedAt
) {
    public static ConfigurationResponse from(SchedulingConfiguration configuration) {
        return new ConfigurationResponse(
                configuration.slotDurationMinutes(),
                configuration.maxAppointmentsPerSlot(),
                configuration.timezone().getId(),
                configuration.minBookingLeadMinutes(),
                configuration.updatedAt()
        );
    }
}
