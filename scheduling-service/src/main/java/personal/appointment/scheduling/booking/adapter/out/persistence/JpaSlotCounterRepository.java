package personal.appointment.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for SlotCounter
 */
public interface JpaSlotCounterRepository extends JpaRepository<SlotCounterEntity, Long> {

    boolean existsBySlotStartAndSlotEnd(Instant slotStart, Instant slotEnd);

    Optional<SlotCounterEntity> findBySlotStartAndSlotEnd(Instant slotStart, Instant slotEnd);

    List<SlotCounterEntity> findBySlotStartGreaterThanEqualAndSlotStartLessThan(Instant from, Instant to);

    /**
     * 용량 미만일 때만 1 증가
     *
     * @return 변경된 행 수 (0이면 용량 초과)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SlotCounterEntity c SET c.bookedCount = c.bookedCount + 1 " +
            "WHERE c.slotStart = :slotStart AND c.slotEnd = :slotEnd AND c.bookedCount < :capacity")
    int incrementIfBelow(@Param("slotStart") Instant slotStart,
                         @Param("slotEnd") Instant slotEnd,
                         @Param("capacity") int capacity);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SlotCounterEntity c SET c.bookedCount = c.bookedCount - 1 " +
            "WHERE c.slotStart = :slotStart AND c.slotEnd = :slotEnd AND c.bookedCount > 0")
    int decrement(@Param("slotStart") Instant slotStart, @Param("slotEnd") Instant slotEnd);
}
