package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Duplicate Booking Exception
 * 예약자가 같은 슬롯에 이미 확정된 예약을 가지고 있을 때 발생하는 예외
 */
public class DuplicateBookingException extends BusinessException {
    public DuplicateBookingException(SlotKey slot, String subjectId) {
        super(ErrorCode.DUPLICATE_BOOKING,
                String.format("Subject already holds this slot: slot=%s, subjectId=%s", slot, subjectId));
    }
}
