package personal.appointment.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.AddExceptionDateRequest;
import personal.appointment.scheduling.availability.adapter.in.web.dto.ExceptionDateCheckResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.ExceptionDateResponse;
import personal.appointment.scheduling.availability.application.port.in.ManageExceptionDateUseCase;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.LocalDate;
import java.util.List;

/**
 * Admin Exception Date API Controller
 * 예외 날짜(휴일, 부재) 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/exception-dates")
@RequiredArgsConstructor
public class AdminExceptionDateController {

    private final ManageExceptionDateUseCase manageExceptionDateUseCase;

    /**
     * 기간 내 예외 날짜 목록
     * GET /api/v1/admin/exception-dates?from=2025-01-01&to=2025-01-31
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ExceptionDateResponse>>> listExceptionDates(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<ExceptionDateResponse> response = manageExceptionDateUseCase.listExceptionDates(from, to).stream()
                .map(ExceptionDateResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("예외 날짜 목록 조회 성공", response));
    }

    /**
     * 예외 날짜 여부 확인
     * GET /api/v1/admin/exception-dates/{date}
     */
    @GetMapping("/{date}")
    public ResponseEntity<ApiResponse<ExceptionDateCheckResponse>> checkExceptionDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        boolean exceptionDate = manageExceptionDateUseCase.isExceptionDate(date);
        return ResponseEntity.ok(ApiResponse.success("예외 날짜 확인 성공",
                new ExceptionDateCheckResponse(date, exceptionDate)));
    }

    /**
     * POST /api/v1/admin/exception-dates
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ExceptionDateResponse>> addExceptionDate(
            @Valid @RequestBody AddExceptionDateRequest request
    ) {
        log.info("Add exception date: date={}", request.date());

        ExceptionDate exceptionDate = manageExceptionDateUseCase.addExceptionDate(request.date(), request.reason());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("예외 날짜 등록 성공", ExceptionDateResponse.from(exceptionDate)));
    }

    /**
     * DELETE /api/v1/admin/exception-dates/{date}
     */
    @DeleteMapping("/{date}")
    public ResponseEntity<ApiResponse<Void>> removeExceptionDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.info("Remove exception date: date={}", date);

        manageExceptionDateUseCase.removeExceptionDate(date);

        return ResponseEntity.ok(ApiResponse.success("예외 날짜 삭제 성공"));
    }
}
