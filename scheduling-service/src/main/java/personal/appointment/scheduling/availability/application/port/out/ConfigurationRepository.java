package personal.appointment.scheduling.availability.application.port.out;

import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

import java.util.Optional;

/**
 * Configuration Repository (Output Port)
 */
public interface ConfigurationRepository {

    /**
     * 현재 유효한 설정 조회 (가장 먼저 생성된 설정)
     */
    Optional<SchedulingConfiguration> findCurrent();

    SchedulingConfiguration save(SchedulingConfiguration configuration);
}
