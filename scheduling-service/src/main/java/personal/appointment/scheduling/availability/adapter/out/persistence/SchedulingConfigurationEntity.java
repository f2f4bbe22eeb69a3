package personal.appointment.scheduling.availability.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Scheduling Configuration JPA Entity
 * 전역 예약 설정 테이블 매핑 (가장 작은 id의 행이 유효한 설정)
 */
@Entity
@Table(name = "scheduling_configuration")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SchedulingConfigurationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_duration_minutes", nullable = false)
    private int slotDurationMinutes;

    @Column(name = "max_appointments_per_slot", nullable = false)
    private int maxAppointmentsPerSlot;

    @Column(nullable = false, length = 50)
    private String timezone;

    @Column(name = "min_booking_lead_minutes", nullable = false)
    private int minBookingLeadMinutes;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static SchedulingConfigurationEntity fromDomain(SchedulingConfiguration configuration) {
        SchedulingConfigurationEntity entity = new SchedulingConfigurationEntity();
        entity.id = configuration.id();
        entity.slotDurationMinutes = configuration.slotDurationMinutes();
        entity.maxAppointmentsPerSlot = configuration.maxAppointmentsPerSlot();
        entity.timezone = configuration.timezone().getId();
        entity.minBookingLeadMinutes = configuration.minBookingLeadMinutes();
        entity.updatedAt = configuration.updatedAt();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public SchedulingConfiguration toDomain() {
        return new SchedulingConfiguration(id, slotDurationMinutes, maxAppointmentsPerSlot,
                ZoneId.of(timezone), minBookingLeadMinutes, updatedAt);
    }
}
