package personal.appointment.scheduling.availability.application.port.in;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Add Availability Rule Command
 */
public record AddAvailabilityRuleCommand(
        DayOfWeek weekday,
        LocalTime startTime,
        LocalTime endTime,
        boolean active,
        boolean recurring
) {
    public static AddAvailabilityRuleCommand of(DayOfWeek weekday, LocalTime startTime, LocalTime endTime) {
        return new AddAvailabilityRuleCommand(weekday, startTime, endTime, true, true);
    }
}
