package personal.appointment.scheduling.availability.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for AvailabilityBlock
 */
public interface JpaAvailabilityBlockRepository extends JpaRepository<AvailabilityBlockEntity, Long> {

    List<AvailabilityBlockEntity> findByDateBetweenOrderByDateAscStartTimeAsc(LocalDate from, LocalDate to);
}
