package personal.appointment.scheduling.booking.adapter.in.web.dto;

import personal.appointment.scheduling.booking.domain.model.SlotAvailability;

import java.time.Instant;

/**
 * 슬롯 조회 응답 DTO
 */
public record SlotResponse(
        Instant startAt,
        Instant endAt,
        int capacity,
        int remainingCapacity
) {
    public static SlotResponse from(SlotAvailability availability) {
        return new SlotResponse(
                availability.slot().startAt(),
                availability.slot().endAt(),
                availability.slot().capacity(),
                availability.remainingCapacity()
        );
    }
}
