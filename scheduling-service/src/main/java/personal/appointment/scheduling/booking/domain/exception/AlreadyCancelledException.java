package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Already Cancelled Exception
 * 이미 취소된 예약을 다시 취소할 때 발생하는 예외
 */
public class AlreadyCancelledException extends BusinessException {
    public AlreadyCancelledException(Long appointmentId) {
        super(ErrorCode.APPOINTMENT_ALREADY_CANCELLED,
                String.format("Appointment is already cancelled: appointmentId=%d", appointmentId));
    }
}
