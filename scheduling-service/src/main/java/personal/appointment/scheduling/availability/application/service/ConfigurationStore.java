package personal.appointment.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.appointment.scheduling.availability.application.port.in.GetConfigurationUseCase;
import personal.appointment.scheduling.availability.application.port.in.UpdateConfigurationCommand;
import personal.appointment.scheduling.availability.application.port.in.UpdateConfigurationUseCase;
import personal.appointment.scheduling.availability.application.port.out.ConfigurationRepository;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;
import personal.appointment.scheduling.config.AppointmentProperties;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Configuration Store
 * 전역 예약 설정의 get-or-initialize 접근자
 * 최초 접근 시 한 번만 기본값으로 생성되고, 이후에는 제자리에서 수정되며 삭제되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigurationStore implements GetConfigurationUseCase, UpdateConfigurationUseCase {

    private final ConfigurationRepository configurationRepository;
    private final AppointmentProperties properties;
    private final Clock clock;
    private final ReentrantLock initializationLock = new ReentrantLock();

    @Override
    public SchedulingConfiguration getConfiguration() {
        return configurationRepository.findCurrent()
                .orElseGet(this::initializeIfAbsent);
    }

    @Override
    public SchedulingConfiguration updateConfiguration(UpdateConfigurationCommand command) {
        SchedulingConfiguration current = getConfiguration();

        // 병합 후보 전체가 검증을 통과해야 저장된다
        SchedulingConfiguration candidate = current.update(
                command.slotDurationMinutes(),
                command.maxAppointmentsPerSlot(),
                command.timezone(),
                command.minBookingLeadMinutes(),
                clock.instant());

        SchedulingConfiguration saved = configurationRepository.save(candidate);
        log.info("Scheduling configuration updated: slotDuration={}m, maxPerSlot={}, timezone={}, lead={}m",
                saved.slotDurationMinutes(), saved.maxAppointmentsPerSlot(),
                saved.timezone(), saved.minBookingLeadMinutes());
        return saved;
    }

    private SchedulingConfiguration initializeIfAbsent() {
        initializationLock.lock();
        try {
            return configurationRepository.findCurrent()
                    .orElseGet(() -> {
                        AppointmentProperties.Defaults defaults = properties.configuration().defaults();
                        SchedulingConfiguration initial = SchedulingConfiguration.initial(
                                defaults.slotDurationMinutes(),
                                defaults.maxAppointmentsPerSlot(),
                                defaults.timezone(),
                                defaults.minBookingLeadMinutes(),
                                clock.instant());
                        log.info("Initializing scheduling configuration with defaults: {}", defaults);
                        return configurationRepository.save(initial);
                    });
        } finally {
            initializationLock.unlock();
        }
    }
}
