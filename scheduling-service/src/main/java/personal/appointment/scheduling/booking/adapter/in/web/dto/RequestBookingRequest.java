package personal.appointment.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingCommand;

import java.time.Instant;

/**
 * 슬롯 예약 요청 DTO
 */
public record RequestBookingRequest(
        @NotNull(message = "슬롯 시작 시각은 필수입니다.")
        Instant slotStart,

        @NotNull(message = "슬롯 종료 시각은 필수입니다.")
        Instant slotEnd
) {
    public RequestBookingCommand toCommand(String subjectId) {
        return new RequestBookingCommand(slotStart, slotEnd, subjectId);
    }
}
