package personal.appointment.scheduling.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.booking.adapter.in.web.dto.AppointmentResponse;
import personal.appointment.scheduling.booking.adapter.in.web.dto.SlotResponse;
import personal.appointment.scheduling.booking.application.port.in.GetAppointmentUseCase;
import personal.appointment.scheduling.booking.application.port.in.ListAvailableSlotsUseCase;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Admin Booking API Controller
 * 관리자용 슬롯 현황 및 예약 목록 REST API
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminBookingController {

    private final ListAvailableSlotsUseCase listAvailableSlotsUseCase;
    private final GetAppointmentUseCase getAppointmentUseCase;

    /**
     * 마감된 슬롯을 포함한 전체 슬롯 현황
     * GET /api/v1/admin/slots?from=2025-03-03&to=2025-03-09
     */
    @GetMapping("/slots")
    public ResponseEntity<ApiResponse<List<SlotResponse>>> listAllSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<SlotResponse> response = listAvailableSlotsUseCase.listAllSlots(from, to).stream()
                .map(SlotResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("슬롯 현황 조회 성공", response));
    }

    /**
     * 예약 목록 (예약자, 상태 필터)
     * GET /api/v1/admin/appointments?subjectId=...&status=CONFIRMED
     */
    @GetMapping("/appointments")
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> listAppointments(
            @RequestParam(required = false) String subjectId,
            @RequestParam(required = false) AppointmentStatus status
    ) {
        List<AppointmentResponse> response = getAppointmentUseCase.listAppointments(subjectId, status).stream()
                .map(AppointmentResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("예약 목록 조회 성공", response));
    }
}
