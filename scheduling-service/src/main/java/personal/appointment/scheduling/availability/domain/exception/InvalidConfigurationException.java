package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Invalid Configuration Exception
 * 예약 설정 값이 유효하지 않을 때 발생하는 예외
 */
public class InvalidConfigurationException extends BusinessException {
    public InvalidConfigurationException(String detail) {
        super(ErrorCode.INVALID_CONFIGURATION, "Invalid configuration: " + detail);
    }
}
