package personal.appointment.scheduling.availability.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for ExceptionDate
 */
public interface JpaExceptionDateRepository extends JpaRepository<ExceptionDateEntity, Long> {

    boolean existsByDate(LocalDate date);

    List<ExceptionDateEntity> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);

    @Transactional
    @Modifying
    @Query("DELETE FROM ExceptionDateEntity e WHERE e.date = :date")
    int deleteByDate(@Param("date") LocalDate date);
}
