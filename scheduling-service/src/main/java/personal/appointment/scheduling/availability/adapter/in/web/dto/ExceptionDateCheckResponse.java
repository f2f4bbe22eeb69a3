package personal.appointment.scheduling.availability.adapter.in.web.dto;

import java.time.LocalDate;

/**
 * 예외 날짜 여부 응답 DTO
 */
public record ExceptionDateCheckResponse(
        LocalDate date,
        boolean exceptionDate
) {
}
