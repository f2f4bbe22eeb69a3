package personal.appointment.scheduling.availability.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.application.port.out.ConfigurationRepository;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

import java.util.Optional;

/**
 * Configuration Persistence Adapter
 * JPA를 사용한 전역 설정 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationPersistenceAdapter implements ConfigurationRepository {

    private final JpaSchedulingConfigurationRepository jpaSchedulingConfigurationRepository;

    @Override
    public Optional<SchedulingConfiguration> findCurrent() {
        return jpaSchedulingConfigurationRepository.findFirstByOrderByIdAsc()
                .map(SchedulingConfigurationEntity::toDomain);
    }

    @Override
    public SchedulingConfiguration save(SchedulingConfiguration configuration) {
        log.debug("Saving scheduling configuration: id={}", configuration.id());
        var saved = jpaSchedulingConfigurationRepository.save(SchedulingConfigurationEntity.fromDomain(configuration));
        return saved.toDomain();
    }
}
