package personal.appointment.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 추가 가용 시간 등록 요청 DTO
 */
public record AddAvailabilityBlockRequest(
        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        LocalTime endTime
) {
}
