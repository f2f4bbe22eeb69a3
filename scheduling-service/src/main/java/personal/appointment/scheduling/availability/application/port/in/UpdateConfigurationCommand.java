package personal.appointment.scheduling.availability.application.port.in;

/**
 * Update Configuration Command
 * null 필드는 변경하지 않는다.
 */
public record UpdateConfigurationCommand(
        Integer slotDurationMinutes,
        Integer maxAppointmentsPerSlot,
        String timezone,
        Integer minBookingLeadMinutes
) {
}
