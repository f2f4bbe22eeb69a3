package personal.appointment.scheduling.availability.application.port.out;

import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Availability Block Repository (Output Port)
 */
public interface AvailabilityBlockRepository {

    AvailabilityBlock save(AvailabilityBlock block);

    Optional<AvailabilityBlock> findById(Long blockId);

    void deleteById(Long blockId);

    /**
     * [from, to] 날짜의 블록 (날짜, 시작 시각 오름차순)
     */
    List<AvailabilityBlock> findBetween(LocalDate from, LocalDate to);
}
