package personal.appointment.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

import java.time.Instant;

/**
 * Slot Counter JPA Entity
 * 슬롯별 확정 예약 수. 조건부 UPDATE의 행 락이 동시 예약을 직렬화한다.
 */
@Entity
@Table(name = "slot_counters",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_slot_counter",
                columnNames = {"slot_start", "slot_end"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotCounterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_start", nullable = false)
    private Instant slotStart;

    @Column(name = "slot_end", nullable = false)
    private Instant slotEnd;

    @Column(name = "booked_count", nullable = false)
    private int bookedCount;

    public static SlotCounterEntity create(SlotKey slot) {
        SlotCounterEntity entity = new SlotCounterEntity();
        entity.slotStart = slot.startAt();
        entity.slotEnd = slot.endAt();
        entity.bookedCount = 0;
        return entity;
    }

    public SlotKey slotKey() {
        return new SlotKey(slotStart, slotEnd);
    }
}
