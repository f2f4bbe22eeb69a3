package personal.appointment.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.appointment.scheduling.availability.application.port.in.AddAvailabilityRuleCommand;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * 가용 시간 규칙 등록 요청 DTO
 * active, recurring 생략 시 true
 */
public record AddAvailabilityRuleRequest(
        @NotNull(message = "요일은 필수입니다.")
        DayOfWeek weekday,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        LocalTime endTime,

        Boolean active,
        Boolean recurring
) {
    public AddAvailabilityRuleCommand toCommand() {
        return new AddAvailabilityRuleCommand(
                weekday,
                startTime,
                endTime,
                active == null || active,
                recurring == null || recurring
        );
    }
}
