package personal.appointment.scheduling.booking.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Appointment Not Found Exception
 * 예약을 찾을 수 없을 때 발생하는 예외
 */
public class AppointmentNotFoundException extends BusinessException {
    public AppointmentNotFoundException(Long appointmentId) {
        super(ErrorCode.APPOINTMENT_NOT_FOUND,
                String.format("Appointment not found: appointmentId=%d", appointmentId));
    }
}
