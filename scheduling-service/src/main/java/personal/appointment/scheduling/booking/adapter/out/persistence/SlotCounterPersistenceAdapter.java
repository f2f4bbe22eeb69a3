package personal.appointment.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.application.port.out.SlotCounterRepository;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Slot Counter Persistence Adapter
 * 조건부 UPDATE 기반 슬롯 용량 원장 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotCounterPersistenceAdapter implements SlotCounterRepository {

    private final JpaSlotCounterRepository jpaSlotCounterRepository;
    private final SlotCounterInitializer slotCounterInitializer;

    @Override
    public boolean tryIncrement(SlotKey slot, int capacity) {
        try {
            slotCounterInitializer.createIfAbsent(slot);
        } catch (DataIntegrityViolationException e) {
            // 다른 요청이 먼저 생성함, 이후 UPDATE는 그 행을 대상으로 한다
            log.debug("Slot counter created concurrently: slot={}", slot);
        }

        int updated = jpaSlotCounterRepository.incrementIfBelow(slot.startAt(), slot.endAt(), capacity);
        log.debug("Slot counter increment: slot={}, capacity={}, updated={}", slot, capacity, updated);
        return updated == 1;
    }

    @Override
    public void release(SlotKey slot) {
        int updated = jpaSlotCounterRepository.decrement(slot.startAt(), slot.endAt());
        if (updated == 0) {
            log.warn("Slot counter already at zero or missing: slot={}", slot);
        }
    }

    @Override
    public Map<SlotKey, Integer> bookedCounts(Instant from, Instant to) {
        return jpaSlotCounterRepository.findBySlotStartGreaterThanEqualAndSlotStartLessThan(from, to).stream()
                .collect(Collectors.toMap(SlotCounterEntity::slotKey, SlotCounterEntity::getBookedCount));
    }
}
