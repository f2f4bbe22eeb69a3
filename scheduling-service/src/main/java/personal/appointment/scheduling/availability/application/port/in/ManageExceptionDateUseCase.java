package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.LocalDate;
import java.util.List;

/**
 * Manage Exception Date UseCase (Input Port)
 * 예외 날짜(휴일, 부재 등) 관리 유스케이스
 */
public interface ManageExceptionDateUseCase {

    /**
     * @throws personal.appointment.scheduling.availability.domain.exception.DuplicateExceptionDateException 같은 날짜가 이미 있을 때
     */
    ExceptionDate addExceptionDate(LocalDate date, String reason);

    /**
     * @throws personal.appointment.scheduling.availability.domain.exception.ExceptionDateNotFoundException 날짜가 없을 때
     */
    void removeExceptionDate(LocalDate date);

    boolean isExceptionDate(LocalDate date);

    /**
     * 기간 내 예외 날짜 목록 (날짜 오름차순)
     */
    List<ExceptionDate> listExceptionDates(LocalDate from, LocalDate to);
}
