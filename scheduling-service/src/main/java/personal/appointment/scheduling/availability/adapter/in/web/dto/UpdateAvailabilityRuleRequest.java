package personal.appointment.scheduling.availability.adapter.in.web.dto;

import personal.appointment.scheduling.availability.application.port.in.UpdateAvailabilityRuleCommand;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * 가용 시간 규칙 수정 요청 DTO
 */
public record UpdateAvailabilityRuleRequest(
        DayOfWeek weekday,
        LocalTime startTime,
        LocalTime endTime,
        Boolean active,
        Boolean recurring
) {
    public UpdateAvailabilityRuleCommand toCommand() {
        return new UpdateAvailabilityRuleCommand(weekday, startTime, endTime, active, recurring);
    }
}
