package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Slot Expired Exception
 * 슬롯 시작이 최소 예약 리드타임 이내일 때 발생하는 예외
 */
public class SlotExpiredException extends BusinessException {
    public SlotExpiredException(SlotKey slot) {
        super(ErrorCode.SLOT_EXPIRED,
                String.format("Slot starts within the booking lead time: slot=%s", slot));
    }
}
