package personal.appointment.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 HTTP Status로, 입력 검증 실패는 INVALID_INPUT으로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                log.warn("Business exception occurred: code={}, message={}, detail={}",
                                errorCode.getCode(), errorCode.getMessage(), e.getMessage());

                ErrorResponse response = ErrorResponse.of(errorCode, errorCode.getMessage());
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.NOT_FOUND,
                                "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
                return ResponseEntity
                                .status(ErrorCode.NOT_FOUND.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, message);
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(ConstraintViolationException.class)
        public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
                log.warn("Constraint violation: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, e.getMessage());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(MissingServletRequestParameterException.class)
        public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
                        MissingServletRequestParameterException e) {
                log.warn("Missing parameter: {}", e.getParameterName());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "필수 파라미터가 누락되었습니다: " + e.getParameterName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(MissingRequestHeaderException.class)
        public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
                log.warn("Missing header: {}", e.getHeaderName());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "필수 헤더가 누락되었습니다: " + e.getHeaderName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
        public ResponseEntity<ErrorResponse> handleUnreadableInput(Exception e) {
                log.warn("Unreadable input: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.INTERNAL_SERVER_ERROR,
                                ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
                return ResponseEntity
                                .status(ErrorCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                                .body(response);
        }
}
