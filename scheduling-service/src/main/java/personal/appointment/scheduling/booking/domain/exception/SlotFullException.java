package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Slot Full Exception
 * 슬롯 용량이 모두 찼을 때 발생하는 예외
 */
public class SlotFullException extends BusinessException {
    public SlotFullException(SlotKey slot) {
        super(ErrorCode.SLOT_FULL,
                String.format("Slot is fully booked: slot=%s", slot));
    }
}
