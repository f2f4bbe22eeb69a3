package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Booking In Progress Exception
 * 같은 예약자의 같은 슬롯 요청이 이미 처리 중일 때 발생하는 예외 (중복 제출)
 */
public class BookingInProgressException extends BusinessException {
    public BookingInProgressException(SlotKey slot, String subjectId) {
        super(ErrorCode.BOOKING_IN_PROGRESS,
                String.format("Booking already in progress: slot=%s, subjectId=%s", slot, subjectId));
    }
}
