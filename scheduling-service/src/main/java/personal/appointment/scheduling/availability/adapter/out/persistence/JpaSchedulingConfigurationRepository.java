package personal.appointment.scheduling.availability.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for SchedulingConfiguration
 */
public interface JpaSchedulingConfigurationRepository extends JpaRepository<SchedulingConfigurationEntity, Long> {

    Optional<SchedulingConfigurationEntity> findFirstByOrderByIdAsc();
}
