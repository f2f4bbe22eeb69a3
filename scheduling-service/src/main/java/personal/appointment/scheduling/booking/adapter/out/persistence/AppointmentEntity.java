package personal.appointment.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.Instant;

/**
 * Appointment JPA Entity
 */
@Entity
@Table(name = "appointments",
        indexes = {
                @Index(name = "idx_slot_subject_status", columnList = "slot_start, slot_end, subject_id, status"),
                @Index(name = "idx_subject_created", columnList = "subject_id, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AppointmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_start", nullable = false)
    private Instant slotStart;

    @Column(name = "slot_end", nullable = false)
    private Instant slotEnd;

    @Column(name = "subject_id", nullable = false, length = 100)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    public static AppointmentEntity fromDomain(Appointment appointment) {
        AppointmentEntity entity = new AppointmentEntity();
        entity.id = appointment.id();
        entity.slotStart = appointment.slotStart();
        entity.slotEnd = appointment.slotEnd();
        entity.subjectId = appointment.subjectId();
        entity.status = appointment.status();
        entity.createdAt = appointment.createdAt();
        entity.cancelledAt = appointment.cancelledAt();
        return entity;
    }

    public Appointment toDomain() {
        return new Appointment(id, slotStart, slotEnd, subjectId, status, createdAt, cancelledAt);
    }
}
