package personal.appointment.scheduling.booking.domain.model;

import personal.appointment.scheduling.availability.domain.model.TimeSlot;

/**
 * Slot Availability
 * 생성된 슬롯과 원장의 예약 수를 합친 조회 결과
 *
 * @param slot              슬롯
 * @param remainingCapacity 남은 예약 가능 수 (0 이상)
 */
public record SlotAvailability(TimeSlot slot, int remainingCapacity) {

    public static SlotAvailability of(TimeSlot slot, int bookedCount) {
        return new SlotAvailability(slot, Math.max(0, slot.capacity() - bookedCount));
    }

    public boolean isBookable() {
        return remainingCapacity > 0;
    }
}
