package personal.appointment.scheduling.availability.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Availability Snapshot
 * 슬롯 생성에 필요한 설정, 규칙, 예외 날짜, 추가 가용 블록을 한 시점에 묶은 불변 입력
 */
public record AvailabilitySnapshot(
        SchedulingConfiguration configuration,
        List<AvailabilityRule> rules,
        Set<LocalDate> exceptionDates,
        List<AvailabilityBlock> blocks) {
    public AvailabilitySnapshot {
        rules = List.copyOf(rules);
        exceptionDates = Set.copyOf(exceptionDates);
        blocks = List.copyOf(blocks);
    }

    public AvailabilitySnapshot(SchedulingConfiguration configuration,
                                List<AvailabilityRule> rules,
                                Set<LocalDate> exceptionDates) {
        this(configuration, rules, exceptionDates, List.of());
    }

    public List<AvailabilityRule> activeRulesOn(DayOfWeek weekday) {
        return rules.stream()
                .filter(rule -> rule.appliesTo(weekday))
                .toList();
    }

    public List<AvailabilityBlock> blocksOn(LocalDate date) {
        return blocks.stream()
                .filter(block -> block.date().equals(date))
                .toList();
    }

    public boolean isExceptionDate(LocalDate date) {
        return exceptionDates.contains(date);
    }
}
