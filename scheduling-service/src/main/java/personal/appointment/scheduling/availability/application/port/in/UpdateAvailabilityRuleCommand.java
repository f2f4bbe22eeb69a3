package personal.appointment.scheduling.availability.application.port.in;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Update Availability Rule Command
 * null 필드는 변경하지 않는다.
 */
public record UpdateAvailabilityRuleCommand(
        DayOfWeek weekday,
        LocalTime startTime,
        LocalTime endTime,
        Boolean active,
        Boolean recurring
) {
}
