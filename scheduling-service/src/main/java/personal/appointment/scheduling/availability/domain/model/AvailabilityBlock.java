package personal.appointment.scheduling.availability.domain.model;

import personal.appointment.scheduling.availability.domain.exception.InvalidAvailabilityBlockException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Availability Block Domain Model
 * 반복 규칙과 별개로 특정 날짜에만 추가로 여는 가용 시간 (설정 타임존 기준 현지 시각)
 * 예외 날짜로 지정된 날에는 적용되지 않는다.
 */
public record AvailabilityBlock(
        Long id,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        Instant createdAt) {
    public AvailabilityBlock {
        if (date == null) {
            throw new InvalidAvailabilityBlockException("date cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new InvalidAvailabilityBlockException("startTime and endTime are required");
        }
        if (!endTime.isAfter(startTime)) {
            throw new InvalidAvailabilityBlockException(
                    String.format("endTime must be after startTime: %s %s-%s", date, startTime, endTime));
        }
        if (createdAt == null) {
            throw new InvalidAvailabilityBlockException("createdAt cannot be null");
        }
    }

    public static AvailabilityBlock create(LocalDate date, LocalTime startTime, LocalTime endTime, Instant now) {
        return new AvailabilityBlock(null, date, startTime, endTime, now);
    }
}
