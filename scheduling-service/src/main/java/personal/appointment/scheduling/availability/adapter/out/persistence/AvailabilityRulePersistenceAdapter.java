package personal.appointment.scheduling.availability.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Availability Rule Persistence Adapter
 * JPA를 사용한 가용 시간 규칙 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityRulePersistenceAdapter implements AvailabilityRuleRepository {

    // weekday는 문자열 컬럼이라 DB 정렬이 요일 순서와 다르다
    private static final Comparator<AvailabilityRule> WEEKDAY_THEN_START =
            Comparator.comparing(AvailabilityRule::weekday).thenComparing(AvailabilityRule::startTime);

    private final JpaAvailabilityRuleRepository jpaAvailabilityRuleRepository;

    @Override
    public AvailabilityRule save(AvailabilityRule rule) {
        log.debug("Saving availability rule: ruleId={}, weekday={}", rule.id(), rule.weekday());
        var saved = jpaAvailabilityRuleRepository.save(AvailabilityRuleEntity.fromDomain(rule));
        return saved.toDomain();
    }

    @Override
    public Optional<AvailabilityRule> findById(Long ruleId) {
        return jpaAvailabilityRuleRepository.findById(ruleId)
                .map(AvailabilityRuleEntity::toDomain);
    }

    @Override
    public void deleteById(Long ruleId) {
        jpaAvailabilityRuleRepository.deleteById(ruleId);
    }

    @Override
    public List<AvailabilityRule> findByWeekday(DayOfWeek weekday) {
        return jpaAvailabilityRuleRepository.findByWeekdayOrderByStartTimeAsc(weekday).stream()
                .map(AvailabilityRuleEntity::toDomain)
                .toList();
    }

    @Override
    public List<AvailabilityRule> findAll() {
        return jpaAvailabilityRuleRepository.findAll().stream()
                .map(AvailabilityRuleEntity::toDomain)
                .sorted(WEEKDAY_THEN_START)
                .toList();
    }

    @Override
    public List<AvailabilityRule> findActive() {
        return jpaAvailabilityRuleRepository.findByActiveTrue().stream()
                .map(AvailabilityRuleEntity::toDomain)
                .sorted(WEEKDAY_THEN_START)
                .toList();
    }
}
