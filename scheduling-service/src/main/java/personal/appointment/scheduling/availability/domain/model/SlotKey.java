package personal.appointment.scheduling.availability.domain.model;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Slot Key
 * 슬롯 식별자 [startAt, endAt) - 예약 원장이 용량을 관리하는 단위
 */
public record SlotKey(Instant startAt, Instant endAt) {
    public SlotKey {
        if (startAt == null || endAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot bounds cannot be null");
        }
        if (!endAt.isAfter(startAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Slot end must be after start: %s-%s", startAt, endAt));
        }
    }

    @Override
    public String toString() {
        return startAt + "/" + endAt;
    }
}
