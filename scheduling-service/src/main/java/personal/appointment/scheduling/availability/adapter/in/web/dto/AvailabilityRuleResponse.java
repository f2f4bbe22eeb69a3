package personal.appointment.scheduling.availability.adapter.in.web.dto;

import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

/**
 * 가용 시간 규칙 응답 DTO
 */
public record AvailabilityRuleResponse(
        Long ruleId,
        DayOfWeek weekday,
        LocalTime startTime,
        LocalTime endTime,
        boolean active,
        boolean recurring,
        Instant createdAt,
        Instant updatedAt
) {
    public static AvailabilityRuleResponse from(AvailabilityRule rule) {
        return new AvailabilityRuleResponse(
                rule.id(),
                rule.weekday(),
                rule.startTime(),
                rule.endTime(),
                rule.active(),
                rule.recurring(),
                rule.createdAt(),
                rule.updatedAt()
        );
    }
}
