package personal.appointment.scheduling.availability.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityBlockRepository;
import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Availability Block Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityBlockPersistenceAdapter implements AvailabilityBlockRepository {

    private final JpaAvailabilityBlockRepository jpaAvailabilityBlockRepository;

    @Override
    public AvailabilityBlock save(AvailabilityBlock block) {
        log.debug("Saving availability block: date={}, {}-{}", block.date(), block.startTime(), block.endTime());
        return jpaAvailabilityBlockRepository.save(AvailabilityBlockEntity.fromDomain(block)).toDomain();
    }

    @Override
    public Optional<AvailabilityBlock> findById(Long blockId) {
        return jpaAvailabilityBlockRepository.findById(blockId)
                .map(AvailabilityBlockEntity::toDomain);
    }

    @Override
    public void deleteById(Long blockId) {
        jpaAvailabilityBlockRepository.deleteById(blockId);
    }

    @Override
    public List<AvailabilityBlock> findBetween(LocalDate from, LocalDate to) {
        return jpaAvailabilityBlockRepository.findByDateBetweenOrderByDateAscStartTimeAsc(from, to).stream()
                .map(AvailabilityBlockEntity::toDomain)
                .toList();
    }
}
