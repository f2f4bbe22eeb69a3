package personal.appointment.scheduling.booking.application.port.out;

import personal.appointment.scheduling.booking.domain.model.Appointment;

/**
 * Appointment Event Port
 * 예약 상태 변경 이벤트 기록 책임 (Outbox 패턴)
 */
public interface AppointmentEventPort {

    void publishAppointmentEvent(Appointment appointment);
}
