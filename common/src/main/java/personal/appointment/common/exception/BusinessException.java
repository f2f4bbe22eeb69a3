package personal.appointment.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 기반 클래스
 * ErrorCode를 함께 전달하여 GlobalExceptionHandler에서 HTTP 응답으로 변환
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}
