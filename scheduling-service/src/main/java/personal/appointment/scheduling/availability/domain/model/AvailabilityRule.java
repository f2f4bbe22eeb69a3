package personal.appointment.scheduling.availability.domain.model;

import personal.appointment.scheduling.availability.domain.exception.InvalidRuleException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

/**
 * Availability Rule Domain Model
 * 요일별 반복 가용 시간 규칙 (불변)
 * recurring 플래그는 기록만 하며 슬롯 생성에는 영향을 주지 않는다.
 */
public record AvailabilityRule(
        Long id,
        DayOfWeek weekday,
        LocalTime startTime,
        LocalTime endTime,
        boolean active,
        boolean recurring,
        Instant createdAt,
        Instant updatedAt) {
    public AvailabilityRule {
        if (weekday == null) {
            throw new InvalidRuleException("weekday cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new InvalidRuleException("startTime and endTime are required");
        }
        if (!endTime.isAfter(startTime)) {
            throw new InvalidRuleException(
                    String.format("endTime must be after startTime: %s-%s", startTime, endTime));
        }
        if (createdAt == null || updatedAt == null) {
            throw new InvalidRuleException("timestamps cannot be null");
        }
    }

    /**
     * 규칙 생성 (정적 팩토리 메서드)
     */
    public static AvailabilityRule create(DayOfWeek weekday, LocalTime startTime, LocalTime endTime,
                                          boolean active, boolean recurring, Instant now) {
        return new AvailabilityRule(null, weekday, startTime, endTime, active, recurring, now, now);
    }

    /**
     * 규칙 수정 (null 필드는 기존 값 유지)
     * 병합된 구간으로 다시 검증한다.
     */
    public AvailabilityRule update(DayOfWeek weekday, LocalTime startTime, LocalTime endTime,
                                   Boolean active, Boolean recurring, Instant now) {
        return new AvailabilityRule(
                id,
                weekday != null ? weekday : this.weekday,
                startTime != null ? startTime : this.startTime,
                endTime != null ? endTime : this.endTime,
                active != null ? active : this.active,
                recurring != null ? recurring : this.recurring,
                createdAt,
                now);
    }

    public boolean appliesTo(DayOfWeek day) {
        return active && weekday == day;
    }
}
