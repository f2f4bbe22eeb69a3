package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Invalid Window Exception
 * 조회 기간이 올바르지 않을 때 발생하는 예외
 */
public class InvalidWindowException extends BusinessException {
    public InvalidWindowException(String detail) {
        super(ErrorCode.INVALID_WINDOW, "Invalid slot window: " + detail);
    }
}
