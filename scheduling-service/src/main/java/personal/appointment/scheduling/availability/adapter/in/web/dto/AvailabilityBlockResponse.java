package personal.appointment.scheduling.availability.adapter.in.web.dto;

import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 추가 가용 시간 응답 DTO
 */
public record AvailabilityBlockResponse(
        Long blockId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        Instant createdAt
) {
    public static AvailabilityBlockResponse from(AvailabilityBlock block) {
        return new AvailabilityBlockResponse(
                block.id(),
                block.date(),
                block.startTime(),
                block.endTime(),
                block.createdAt()
        );
    }
}
