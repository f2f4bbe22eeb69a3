package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Slot Unavailable Exception
 * 요청한 구간이 현재 규칙/설정으로 생성되는 슬롯이 아닐 때 발생하는 예외
 */
public class SlotUnavailableException extends BusinessException {
    public SlotUnavailableException(SlotKey slot) {
        super(ErrorCode.SLOT_UNAVAILABLE,
                String.format("Slot is not offered: slot=%s", slot));
    }
}
