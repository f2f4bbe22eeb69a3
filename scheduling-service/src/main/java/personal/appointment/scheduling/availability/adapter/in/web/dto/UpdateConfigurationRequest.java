package personal.appointment.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import personal.appointment.scheduling.availability.application.port.in.UpdateConfigurationCommand;

/**
 * 전역 예약 설정 수정 요청 DTO
 * 생략한 필드는 기존 값을 유지한다.
 */
public record UpdateConfigurationRequest(
        @Positive(message = "슬롯 길이는 1분 이상이어야 합니다.")
        Integer slotDurationMinutes,

        @Positive(message = "슬롯당 최대 예약 수는 1 이상이어야 합니다.")
        Integer maxAppointmentsPerSlot,

        String timezone,

        @PositiveOrZero(message = "최소 예약 리드타임은 0 이상이어야 합니다.")
        Integer minBookingLeadMinutes
) {
    public UpdateConfigurationCommand toCommand() {
        return new UpdateConfigurationCommand(slotDurationMinutes, maxAppointmentsPerSlot, timezone, minBookingLeadMinutes);
    }
}
