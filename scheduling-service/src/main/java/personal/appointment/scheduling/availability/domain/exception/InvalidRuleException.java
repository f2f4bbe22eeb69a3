package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Invalid Rule Exception
 * 가용 시간 규칙이 올바르지 않을 때 발생하는 예외
 */
public class InvalidRuleException extends BusinessException {
    public InvalidRuleException(String detail) {
        super(ErrorCode.INVALID_RULE, "Invalid availability rule: " + detail);
    }
}
