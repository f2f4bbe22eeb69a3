package personal.appointment.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.AddAvailabilityBlockRequest;
import personal.appointment.scheduling.availability.adapter.in.web.dto.AvailabilityBlockResponse;
import personal.appointment.scheduling.availability.application.port.in.ManageAvailabilityBlockUseCase;
import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.LocalDate;
import java.util.List;

/**
 * Admin Availability Block API Controller
 * 특정 날짜 추가 가용 시간 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/availability-blocks")
@RequiredArgsConstructor
public class AdminAvailabilityBlockController {

    private final ManageAvailabilityBlockUseCase manageAvailabilityBlockUseCase;

    /**
     * GET /api/v1/admin/availability-blocks?from=2025-03-01&to=2025-03-31
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<AvailabilityBlockResponse>>> listBlocks(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<AvailabilityBlockResponse> response = manageAvailabilityBlockUseCase.listBlocks(from, to).stream()
                .map(AvailabilityBlockResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("추가 가용 시간 목록 조회 성공", response));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AvailabilityBlockResponse>> addBlock(
            @Valid @RequestBody AddAvailabilityBlockRequest request
    ) {
        log.info("Add availability block: date={}, start={}, end={}",
                request.date(), request.startTime(), request.endTime());

        AvailabilityBlock block = manageAvailabilityBlockUseCase.addBlock(
                request.date(), request.startTime(), request.endTime());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("추가 가용 시간 등록 성공", AvailabilityBlockResponse.from(block)));
    }

    @DeleteMapping("/{blockId}")
    public ResponseEntity<ApiResponse<Void>> removeBlock(@PathVariable Long blockId) {
        log.info("Remove availability block: blockId={}", blockId);

        manageAvailabilityBlockUseCase.removeBlock(blockId);

        return ResponseEntity.ok(ApiResponse.success("추가 가용 시간 삭제 성공"));
    }
}
