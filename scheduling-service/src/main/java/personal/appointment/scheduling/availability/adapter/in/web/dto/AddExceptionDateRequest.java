package personal.appointment.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.LocalDate;

/**
 * 예외 날짜 등록 요청 DTO
 */
public record AddExceptionDateRequest(
        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @Size(max = ExceptionDate.MAX_REASON_LENGTH, message = "사유는 200자 이하여야 합니다.")
        String reason
) {
}
