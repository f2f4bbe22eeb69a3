package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Duplicate Exception Date Exception
 * 같은 날짜의 예외 날짜가 이미 등록되어 있을 때 발생하는 예외
 */
public class DuplicateExceptionDateException extends BusinessException {
    public DuplicateExceptionDateException(LocalDate date) {
        super(ErrorCode.EXCEPTION_DATE_DUPLICATED,
                String.format("Exception date already registered: date=%s", date));
    }
}
