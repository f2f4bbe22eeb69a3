package personal.appointment.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.availability.application.port.in.AddAvailabilityRuleCommand;
import personal.appointment.scheduling.availability.application.port.in.ManageAvailabilityRuleUseCase;
import personal.appointment.scheduling.availability.application.port.in.UpdateAvailabilityRuleCommand;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.appointment.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.Clock;
import java.time.DayOfWeek;
import java.util.List;

/**
 * Availability Rule Set
 * 요일별 반복 가용 시간 규칙 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityRuleSet implements ManageAvailabilityRuleUseCase {

    private final AvailabilityRuleRepository availabilityRuleRepository;
    private final Clock clock;

    @Override
    @Transactional
    public AvailabilityRule addRule(AddAvailabilityRuleCommand command) {
        AvailabilityRule rule = AvailabilityRule.create(
                command.weekday(),
                command.startTime(),
                command.endTime(),
                command.active(),
                command.recurring(),
                clock.instant());

        AvailabilityRule saved = availabilityRuleRepository.save(rule);
        log.info("Availability rule added: ruleId={}, weekday={}, {}-{}, active={}",
                saved.id(), saved.weekday(), saved.startTime(), saved.endTime(), saved.active());
        return saved;
    }

    @Override
    @Transactional
    public AvailabilityRule updateRule(Long ruleId, UpdateAvailabilityRuleCommand command) {
        AvailabilityRule rule = getRule(ruleId);

        AvailabilityRule updated = rule.update(
                command.weekday(),
                command.startTime(),
                command.endTime(),
                command.active(),
                command.recurring(),
                clock.instant());

        AvailabilityRule saved = availabilityRuleRepository.save(updated);
        log.info("Availability rule updated: ruleId={}, weekday={}, {}-{}, active={}",
                saved.id(), saved.weekday(), saved.startTime(), saved.endTime(), saved.active());
        return saved;
    }

    @Override
    @Transactional
    public void removeRule(Long ruleId) {
        getRule(ruleId);
        availabilityRuleRepository.deleteById(ruleId);
        log.info("Availability rule removed: ruleId={}", ruleId);
    }

    @Override
    public AvailabilityRule getRule(Long ruleId) {
        return availabilityRuleRepository.findById(ruleId)
                .orElseThrow(() -> {
                    log.warn("Availability rule not found: ruleId={}", ruleId);
                    return new AvailabilityRuleNotFoundException(ruleId);
                });
    }

    @Override
    public List<AvailabilityRule> listRules(DayOfWeek weekday) {
        return availabilityRuleRepository.findByWeekday(weekday);
    }

    @Override
    public List<AvailabilityRule> listAllRules() {
        return availabilityRuleRepository.findAll();
    }
}
