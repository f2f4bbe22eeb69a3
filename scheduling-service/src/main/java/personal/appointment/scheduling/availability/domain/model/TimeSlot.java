package personal.appointment.scheduling.availability.domain.model;

import java.time.Instant;

/**
 * Time Slot
 * 규칙으로부터 계산되는 예약 가능 슬롯 (저장하지 않는 값 객체)
 *
 * @param startAt  시작 시각 (UTC)
 * @param endAt    종료 시각 (UTC), endAt - startAt == 슬롯 길이
 * @param capacity 생성 시점의 슬롯당 최대 예약 수
 */
public record TimeSlot(Instant startAt, Instant endAt, int capacity) {

    public SlotKey key() {
        return new SlotKey(startAt, endAt);
    }
}
