package personal.appointment.scheduling.availability.application.port.out;

import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

/**
 * Availability Rule Repository (Output Port)
 */
public interface AvailabilityRuleRepository {

    AvailabilityRule save(AvailabilityRule rule);

    Optional<AvailabilityRule> findById(Long ruleId);

    void deleteById(Long ruleId);

    /**
     * 요일별 규칙 (시작 시각 오름차순)
     */
    List<AvailabilityRule> findByWeekday(DayOfWeek weekday);

    /**
     * 전체 규칙 (요일, 시작 시각 오름차순)
     */
    List<AvailabilityRule> findAll();

    /**
     * 활성 규칙만 조회
     */
    List<AvailabilityRule> findActive();
}
