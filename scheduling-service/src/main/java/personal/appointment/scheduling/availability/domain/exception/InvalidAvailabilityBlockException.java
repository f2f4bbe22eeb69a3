package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Invalid Availability Block Exception
 * 추가 가용 블록의 날짜나 시간 구간이 올바르지 않을 때 발생하는 예외
 */
public class InvalidAvailabilityBlockException extends BusinessException {
    public InvalidAvailabilityBlockException(String detail) {
        super(ErrorCode.INVALID_BLOCK, "Invalid availability block: " + detail);
    }
}
