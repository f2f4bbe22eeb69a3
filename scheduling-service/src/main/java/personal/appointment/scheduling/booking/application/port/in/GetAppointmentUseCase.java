package personal.appointment.scheduling.booking.application.port.in;

import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.util.List;

/**
 * Get Appointment UseCase (Input Port)
 * 예약 조회 유스케이스
 */
public interface GetAppointmentUseCase {

    /**
     * @throws personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException 예약이 없을 때
     */
    Appointment getAppointment(Long appointmentId);

    /**
     * 예약 목록 (생성 시각 내림차순)
     *
     * @param subjectId 예약자 필터 (null이면 전체)
     * @param status    상태 필터 (null이면 전체)
     */
    List<Appointment> listAppointments(String subjectId, AppointmentStatus status);
}
