package personal.appointment.scheduling.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.booking.adapter.in.web.dto.SlotResponse;
import personal.appointment.scheduling.booking.application.port.in.ListAvailableSlotsUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability API Controller
 * 예약 가능 슬롯 조회 REST API
 */
@RestController
@RequestMapping("/api/v1/slots")
@RequiredArgsConstructor
public class AvailabilityController {

    private final ListAvailableSlotsUseCase listAvailableSlotsUseCase;

    /**
     * 예약 가능한 슬롯 목록 조회 (설정 타임존 기준 날짜, 양 끝 포함)
     * GET /api/v1/slots?from=2025-03-03&to=2025-03-09
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<SlotResponse>>> listAvailableSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<SlotResponse> response = listAvailableSlotsUseCase.listAvailableSlots(from, to).stream()
                .map(SlotResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("슬롯 조회 성공", response));
    }
}
