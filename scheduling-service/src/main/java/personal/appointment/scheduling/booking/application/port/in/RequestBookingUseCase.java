package personal.appointment.scheduling.booking.application.port.in;

import personal.appointment.scheduling.booking.domain.model.Appointment;

/**
 * Request Booking UseCase (Input Port)
 * 슬롯 예약 유스케이스
 */
public interface RequestBookingUseCase {

    /**
     * 슬롯 예약
     * 구간은 현재 생성되는 슬롯과 정확히 일치해야 한다 (보정하지 않음).
     *
     * @return 확정된 예약
     * @throws personal.appointment.scheduling.booking.domain.exception.SlotUnavailableException 슬롯이 아닐 때
     * @throws personal.appointment.scheduling.booking.domain.exception.SlotExpiredException 리드타임 이내일 때
     * @throws personal.appointment.scheduling.booking.domain.exception.SlotFullException 용량이 찼을 때
     * @throws personal.appointment.scheduling.booking.domain.exception.BookingInProgressException 같은 요청이 처리 중일 때
     * @throws personal.appointment.scheduling.booking.domain.exception.DuplicateBookingException 이미 같은 슬롯을 예약했을 때
     */
    Appointment requestBooking(RequestBookingCommand command);
}
