package personal.appointment.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Availability Domain (Axxx)
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST, "A001", "유효하지 않은 예약 설정입니다."),
    INVALID_RULE(HttpStatus.BAD_REQUEST, "A002", "유효하지 않은 가용 시간 규칙입니다."),
    RULE_NOT_FOUND(HttpStatus.NOT_FOUND, "A003", "가용 시간 규칙을 찾을 수 없습니다."),
    EXCEPTION_DATE_DUPLICATED(HttpStatus.CONFLICT, "A004", "이미 등록된 예외 날짜입니다."),
    EXCEPTION_DATE_NOT_FOUND(HttpStatus.NOT_FOUND, "A005", "예외 날짜를 찾을 수 없습니다."),
    INVALID_WINDOW(HttpStatus.BAD_REQUEST, "A006", "조회 기간이 올바르지 않습니다."),
    BLOCK_NOT_FOUND(HttpStatus.NOT_FOUND, "A007", "추가 가용 시간을 찾을 수 없습니다."),
    INVALID_BLOCK(HttpStatus.BAD_REQUEST, "A008", "유효하지 않은 추가 가용 시간입니다."),

    // Booking Domain (Bxxx)
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT, "B001", "더 이상 예약할 수 없는 시간입니다. 가능한 시간을 다시 조회해 주세요."),
    SLOT_EXPIRED(HttpStatus.BAD_REQUEST, "B002", "예약 가능 시점이 지났습니다. 더 늦은 시간을 선택해 주세요."),
    SLOT_FULL(HttpStatus.CONFLICT, "B003", "해당 시간의 예약이 마감되었습니다. 다른 시간을 선택해 주세요."),
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "B004", "예약을 찾을 수 없습니다."),
    APPOINTMENT_ALREADY_CANCELLED(HttpStatus.CONFLICT, "B005", "이미 취소된 예약입니다."),
    BOOKING_IN_PROGRESS(HttpStatus.CONFLICT, "B006", "동일한 예약 요청이 처리 중입니다."),
    DUPLICATE_BOOKING(HttpStatus.CONFLICT, "B007", "이미 같은 시간에 예약이 있습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
