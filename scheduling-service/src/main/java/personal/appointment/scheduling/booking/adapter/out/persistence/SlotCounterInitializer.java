package personal.appointment.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Slot Counter Initializer
 * 카운터 행을 별도 트랜잭션에서 먼저 만들어 둔다.
 * 예약 트랜잭션은 이미 존재하는 행에 대한 조건부 UPDATE만 수행하므로 갭 락 경합이 생기지 않는다.
 */
@Component
@RequiredArgsConstructor
public class SlotCounterInitializer {

    private final JpaSlotCounterRepository jpaSlotCounterRepository;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException 동시에 다른 요청이 먼저 생성했을 때
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createIfAbsent(SlotKey slot) {
        if (!jpaSlotCounterRepository.existsBySlotStartAndSlotEnd(slot.startAt(), slot.endAt())) {
            jpaSlotCounterRepository.saveAndFlush(SlotCounterEntity.create(slot));
        }
    }
}
