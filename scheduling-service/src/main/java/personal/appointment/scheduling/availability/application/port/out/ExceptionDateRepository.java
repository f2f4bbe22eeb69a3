package personal.appointment.scheduling.availability.application.port.out;

import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.LocalDate;
import java.util.List;

/**
 * Exception Date Repository (Output Port)
 */
public interface ExceptionDateRepository {

    /**
     * 저장 (날짜 유니크 제약 위반 시 DuplicateExceptionDateException)
     */
    ExceptionDate save(ExceptionDate exceptionDate);

    boolean existsByDate(LocalDate date);

    /**
     * @return 삭제된 건수 (0 또는 1)
     */
    int deleteByDate(LocalDate date);

    List<ExceptionDate> findBetween(LocalDate from, LocalDate to);
}
