package personal.appointment.scheduling.booking.application.port.out;

import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Appointment Repository (Output Port)
 */
public interface AppointmentRepository {

    /**
     * 예약 저장 (상태 변경 이벤트는 Outbox에 함께 기록된다)
     */
    Appointment save(Appointment appointment);

    Optional<Appointment> findById(Long appointmentId);

    /**
     * 비관적 쓰기 락으로 조회 (SELECT ... FOR UPDATE)
     * 동시 취소를 직렬화한다.
     */
    Optional<Appointment> findByIdForUpdate(Long appointmentId);

    /**
     * 예약자가 해당 슬롯에 CONFIRMED 예약을 가지고 있는지 확인
     */
    boolean existsConfirmed(SlotKey slot, String subjectId);

    /**
     * 생성 시각 내림차순 목록 (null 필터는 무시)
     */
    List<Appointment> findAll(String subjectId, AppointmentStatus status);
}
