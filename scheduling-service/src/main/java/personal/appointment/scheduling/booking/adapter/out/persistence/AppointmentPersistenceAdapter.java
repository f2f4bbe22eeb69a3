package personal.appointment.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.application.port.out.AppointmentEventPort;
import personal.appointment.scheduling.booking.application.port.out.AppointmentRepository;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Appointment Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * Transactional Outbox Pattern: AppointmentEventPort에 이벤트 기록 위임
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentPersistenceAdapter implements AppointmentRepository {

    private final JpaAppointmentRepository jpaAppointmentRepository;
    private final AppointmentEventPort appointmentEventPort;

    @Override
    public Appointment save(Appointment appointment) {
        log.debug("Saving appointment: appointmentId={}, status={}", appointment.id(), appointment.status());

        var saved = jpaAppointmentRepository.save(AppointmentEntity.fromDomain(appointment)).toDomain();

        // 같은 트랜잭션에서 Outbox 기록
        appointmentEventPort.publishAppointmentEvent(saved);

        return saved;
    }

    @Override
    public Optional<Appointment> findById(Long appointmentId) {
        return jpaAppointmentRepository.findById(appointmentId)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public Optional<Appointment> findByIdForUpdate(Long appointmentId) {
        log.debug("Locking appointment: appointmentId={}", appointmentId);
        return jpaAppointmentRepository.findByIdForUpdate(appointmentId)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public boolean existsConfirmed(SlotKey slot, String subjectId) {
        return jpaAppointmentRepository.existsBySlotStartAndSlotEndAndSubjectIdAndStatus(
                slot.startAt(), slot.endAt(), subjectId, AppointmentStatus.CONFIRMED);
    }

    @Override
    public List<Appointment> findAll(String subjectId, AppointmentStatus status) {
        return jpaAppointmentRepository.search(subjectId, status).stream()
                .map(AppointmentEntity::toDomain)
                .toList();
    }
}
