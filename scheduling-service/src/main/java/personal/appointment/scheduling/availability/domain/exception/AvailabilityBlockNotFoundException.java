package personal.appointment.scheduling.availability.domain.exception;

import personal.appointment.common.exception.BusinessException;
import personal.appointment.common.exception.ErrorCode;

public class AvailabilityBlockNotFoundException extends BusinessException {
    public AvailabilityBlockNotFoundException(Long blockId) {
        super(ErrorCode.BLOCK_NOT_FOUND,
                String.format("Availability block not found: blockId=%d", blockId));
    }
}
