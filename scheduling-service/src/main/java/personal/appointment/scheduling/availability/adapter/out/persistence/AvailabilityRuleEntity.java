package personal.appointment.scheduling.availability.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

/**
 * Availability Rule JPA Entity
 * 요일별 가용 시간 규칙 테이블 매핑
 */
@Entity
@Table(name = "availability_rules",
        indexes = {
                @Index(name = "idx_weekday_active", columnList = "weekday, active")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AvailabilityRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DayOfWeek weekday;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private boolean recurring;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static AvailabilityRuleEntity fromDomain(AvailabilityRule rule) {
        AvailabilityRuleEntity entity = new AvailabilityRuleEntity();
        entity.id = rule.id();
        entity.weekday = rule.weekday();
        entity.startTime = rule.startTime();
        entity.endTime = rule.endTime();
        entity.active = rule.active();
        entity.recurring = rule.recurring();
        entity.createdAt = rule.createdAt();
        entity.updatedAt = rule.updatedAt();
        return entity;
    }

    public AvailabilityRule toDomain() {
        return new AvailabilityRule(id, weekday, startTime, endTime, active, recurring, createdAt, updatedAt);
    }
}
