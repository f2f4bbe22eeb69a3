package personal.appointment.scheduling.booking.application.port.in;

import personal.appointment.scheduling.booking.domain.model.Appointment;

/**
 * Cancel Booking UseCase (Input Port)
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소 후 슬롯 용량 반환
     *
     * @throws personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException 예약이 없을 때
     * @throws personal.appointment.scheduling.booking.domain.exception.AlreadyCancelledException 이미 취소됐을 때
     */
    Appointment cancelBooking(Long appointmentId);
}
