package personal.appointment.scheduling.availability.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Spring Data JPA Repository for AvailabilityRule
 */
public interface JpaAvailabilityRuleRepository extends JpaRepository<AvailabilityRuleEntity, Long> {

    List<AvailabilityRuleEntity> findByWeekdayOrderByStartTimeAsc(DayOfWeek weekday);

    List<AvailabilityRuleEntity> findByActiveTrue();
}
