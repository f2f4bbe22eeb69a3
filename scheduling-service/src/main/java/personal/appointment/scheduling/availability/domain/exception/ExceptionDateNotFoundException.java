package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Exception Date Not Found Exception
 * 삭제하려는 예외 날짜가 없을 때 발생하는 예외
 */
public class ExceptionDateNotFoundException extends BusinessException {
    public ExceptionDateNotFoundException(LocalDate date) {
        super(ErrorCode.EXCEPTION_DATE_NOT_FOUND,
                String.format("Exception date not found: date=%s", date));
    }
}
