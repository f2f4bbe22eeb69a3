package personal.appointment.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.booking.adapter.in.web.dto.AppointmentResponse;
import personal.appointment.scheduling.booking.adapter.in.web.dto.RequestBookingRequest;
import personal.appointment.scheduling.booking.application.port.in.CancelBookingUseCase;
import personal.appointment.scheduling.booking.application.port.in.GetAppointmentUseCase;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingUseCase;
import personal.appointment.scheduling.booking.domain.model.Appointment;

import java.util.List;

/**
 * Appointment API Controller
 * 예약 생성/취소/조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final RequestBookingUseCase requestBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetAppointmentUseCase getAppointmentUseCase;

    /**
     * 슬롯 예약
     * POST /api/v1/appointments
     */
    @PostMapping
    public ResponseEntity<ApiResponse<AppointmentResponse>> requestBooking(
            @Valid @RequestBody RequestBookingRequest request,
            @RequestHeader("X-Subject-Id") String subjectId
    ) {
        log.info("Request booking: subjectId={}, slotStart={}, slotEnd={}",
                subjectId, request.slotStart(), request.slotEnd());

        Appointment appointment = requestBookingUseCase.requestBooking(request.toCommand(subjectId));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("예약 성공", AppointmentResponse.from(appointment)));
    }

    /**
     * 예약 취소
     * POST /api/v1/appointments/{appointmentId}/cancel
     */
    @PostMapping("/{appointmentId}/cancel")
    public ResponseEntity<ApiResponse<AppointmentResponse>> cancelBooking(@PathVariable Long appointmentId) {
        log.info("Cancel booking: appointmentId={}", appointmentId);

        Appointment cancelled = cancelBookingUseCase.cancelBooking(appointmentId);

        return ResponseEntity.ok(ApiResponse.success("예약 취소 성공", AppointmentResponse.from(cancelled)));
    }

    /**
     * GET /api/v1/appointments/{appointmentId}
     */
    @GetMapping("/{appointmentId}")
    public ResponseEntity<ApiResponse<AppointmentResponse>> getAppointment(@PathVariable Long appointmentId) {
        Appointment appointment = getAppointmentUseCase.getAppointment(appointmentId);
        return ResponseEntity.ok(ApiResponse.success("예약 조회 성공", AppointmentResponse.from(appointment)));
    }

    /**
     * 내 예약 목록 (최신순)
     * GET /api/v1/appointments
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> listMyAppointments(
            @RequestHeader("X-Subject-Id") String subjectId
    ) {
        List<AppointmentResponse> response = getAppointmentUseCase.listAppointments(subjectId, null).stream()
                .map(AppointmentResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("예약 목록 조회 성공", response));
    }
}
