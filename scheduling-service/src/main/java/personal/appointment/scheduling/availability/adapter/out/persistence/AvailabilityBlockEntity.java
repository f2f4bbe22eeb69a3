package personal.appointment.scheduling.availability.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Availability Block JPA Entity
 */
@Entity
@Table(name = "availability_blocks",
        indexes = {
                @Index(name = "idx_block_date", columnList = "block_date, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AvailabilityBlockEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "block_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AvailabilityBlockEntity fromDomain(AvailabilityBlock block) {
        AvailabilityBlockEntity entity = new AvailabilityBlockEntity();
        entity.id = block.id();
        entity.date = block.date();
        entity.startTime = block.startTime();
        entity.endTime = block.endTime();
        entity.createdAt = block.createdAt();
        return entity;
    }

    public AvailabilityBlock toDomain() {
        return new AvailabilityBlock(id, date, startTime, endTime, createdAt);
    }
}
