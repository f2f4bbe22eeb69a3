package personal.appointment.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.appointment.scheduling.availability.application.port.in.GetConfigurationUseCase;
import personal.appointment.scheduling.availability.application.port.in.LoadAvailabilitySnapshotUseCase;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityBlockRepository;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.appointment.scheduling.availability.application.port.out.ExceptionDateRepository;
import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Availability Snapshot Loader
 * 설정, 활성 규칙, 구간 내 예외 날짜와 추가 가용 블록을 읽어 SlotGenerator 입력으로 묶는다.
 * 설정이 아직 없으면 여기서 생성될 수 있으므로 읽기 전용 트랜잭션으로 감싸지 않는다.
 */
@Service
@RequiredArgsConstructor
public class AvailabilitySnapshotLoader implements LoadAvailabilitySnapshotUseCase {

    private final GetConfigurationUseCase getConfigurationUseCase;
    private final AvailabilityRuleRepository availabilityRuleRepository;
    private final ExceptionDateRepository exceptionDateRepository;
    private final AvailabilityBlockRepository availabilityBlockRepository;

    @Override
    public AvailabilitySnapshot loadSnapshot(LocalDate from, LocalDate to) {
        return load(getConfigurationUseCase.getConfiguration(), from, to);
    }

    @Override
    public AvailabilitySnapshot loadSnapshotAt(Instant instant) {
        SchedulingConfiguration configuration = getConfigurationUseCase.getConfiguration();
        LocalDate date = LocalDateTime.ofInstant(instant, configuration.timezone()).toLocalDate();
        return load(configuration, date, date);
    }

    private AvailabilitySnapshot load(SchedulingConfiguration configuration, LocalDate from, LocalDate to) {
        Set<LocalDate> exceptionDates = exceptionDateRepository.findBetween(from, to).stream()
                .map(ExceptionDate::date)
                .collect(Collectors.toSet());

        return new AvailabilitySnapshot(
                configuration,
                availabilityRuleRepository.findActive(),
                exceptionDates,
                availabilityBlockRepository.findBetween(from, to));
    }
}
