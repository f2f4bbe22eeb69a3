package personal.appointment.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Appointment
 */
public interface JpaAppointmentRepository extends JpaRepository<AppointmentEntity, Long> {

    /**
     * 비관적 쓰기 락 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AppointmentEntity a WHERE a.id = :id")
    Optional<AppointmentEntity> findByIdForUpdate(@Param("id") Long id);

    boolean existsBySlotStartAndSlotEndAndSubjectIdAndStatus(
            Instant slotStart, Instant slotEnd, String subjectId, AppointmentStatus status);

    @Query("SELECT a FROM AppointmentEntity a " +
            "WHERE (:subjectId IS NULL OR a.subjectId = :subjectId) " +
            "AND (:status IS NULL OR a.status = :status) " +
            "ORDER BY a.createdAt DESC, a.id DESC")
    List<AppointmentEntity> search(@Param("subjectId") String subjectId,
                                   @Param("status") AppointmentStatus status);
}
