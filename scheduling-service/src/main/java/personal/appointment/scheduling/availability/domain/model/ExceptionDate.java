package personal.appointment.scheduling.availability.domain.model;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Exception Date Domain Model
 * 가용 시간에서 제외되는 특정 날짜 (휴일, 부재 등)
 */
public record ExceptionDate(
        Long id,
        LocalDate date,
        String reason,
        Instant createdAt) {

    public static final int MAX_REASON_LENGTH = 200;

    public ExceptionDate {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Exception date cannot be null");
        }
        reason = reason == null ? "" : reason.strip();
        if (reason.length() > MAX_REASON_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Exception reason cannot exceed " + MAX_REASON_LENGTH + " characters");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    public static ExceptionDate create(LocalDate date, String reason, Instant now) {
        return new ExceptionDate(null, date, reason, now);
    }
}
