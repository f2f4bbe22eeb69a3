package personal.appointment.scheduling.booking.domain.model;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.domain.exception.AlreadyCancelledException;

import java.time.Instant;

/**
 * Appointment Domain Model
 * 확정된 예약 (불변)
 * 슬롯 시각을 복사해 두므로 이후 규칙/설정 변경의 영향을 받지 않는다.
 */
public record Appointment(
        Long id,
        Instant slotStart,
        Instant slotEnd,
        String subjectId,
        AppointmentStatus status,
        Instant createdAt,
        Instant cancelledAt) {
    public Appointment {
        if (slotStart == null || slotEnd == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot bounds cannot be null");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Subject ID cannot be blank");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 예약 확정 (정적 팩토리 메서드)
     *
     * @param slot      예약할 슬롯
     * @param subjectId 예약자 식별자
     * @param now       현재 시각
     * @return 새로운 예약 (CONFIRMED 상태)
     */
    public static Appointment confirm(SlotKey slot, String subjectId, Instant now) {
        return new Appointment(null, slot.startAt(), slot.endAt(), subjectId,
                AppointmentStatus.CONFIRMED, now, null);
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     *
     * @throws AlreadyCancelledException 이미 취소된 예약일 때
     */
    public Appointment cancel(Instant now) {
        if (status == AppointmentStatus.CANCELLED) {
            throw new AlreadyCancelledException(id);
        }
        return new Appointment(id, slotStart, slotEnd, subjectId,
                AppointmentStatus.CANCELLED, createdAt, now);
    }

    public SlotKey slotKey() {
        return new SlotKey(slotStart, slotEnd);
    }
}
