package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

/**
 * Availability Rule Not Found Exception
 * 가용 시간 규칙을 찾을 수 없을 때 발생하는 예외
 */
public class AvailabilityRuleNotFoundException extends BusinessException {
    public AvailabilityRuleNotFoundException(Long ruleId) {
        super(ErrorCode.RULE_NOT_FOUND,
                String.format("Availability rule not found: ruleId=%d", ruleId));
    }
}
