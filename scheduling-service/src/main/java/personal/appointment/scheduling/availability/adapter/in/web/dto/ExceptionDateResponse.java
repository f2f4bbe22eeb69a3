package personal.appointment.scheduling.availability.adapter.in.web.dto;

import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 예외 날짜 응답 DTO
 */
public record ExceptionDateResponse(
        LocalDate date,
        String reason,
        Instant createdAt
) {
    public static ExceptionDateResponse from(ExceptionDate exceptionDate) {
        return new ExceptionDateResponse(exceptionDate.date(), exceptionDate.reason(), exceptionDate.createdAt());
    }
}
