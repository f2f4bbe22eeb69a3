package personal.appointment.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param code    에러 코드 (e.g. B003)
 * @param message 사용자에게 노출되는 메시지
 */
public record ErrorResponse(
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message);
    }
}
