package personal.appointment.scheduling.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.application.port.in.CancelBookingUseCase;
import personal.appointment.scheduling.booking.application.port.in.GetAppointmentUseCase;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingCommand;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingUseCase;
import personal.appointment.scheduling.booking.domain.exception.AlreadyCancelledException;
import personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException;
import personal.appointment.scheduling.booking.domain.exception.SlotFullException;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Appointment Controller 단위 테스트
 * 요청 매핑, 응답 포맷, 예외 코드 변환을 검증한다.
 */
@WebMvcTest(AppointmentController.class)
@DisplayName("Appointment API 단위 테스트")
class AppointmentControllerTest {

    private static final SlotKey SLOT =
            new SlotKey(Instant.parse("2025-03-03T09:00:00Z"), Instant.parse("2025-03-03T10:00:00Z"));
    private static final Instant NOW = Instant.parse("2025-03-01T00:00:00Z");
    private static final String BOOKING_BODY = """
            {"slotStart":"2025-03-03T09:00:00Z","slotEnd":"2025-03-03T10:00:00Z"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RequestBookingUseCase requestBookingUseCase;
    @MockBean
    private CancelBookingUseCase cancelBookingUseCase;
    @MockBean
    private GetAppointmentUseCase getAppointmentUseCase;

    private Appointment confirmed() {
        return new Appointment(1L, SLOT.startAt(), SLOT.endAt(), "subject-1",
                AppointmentStatus.CONFIRMED, NOW, null);
    }

    @Test
    @DisplayName("예약 성공 시 201과 확정된 예약을 반환한다")
    void requestBooking_Success() throws Exception {
        // given
        given(requestBookingUseCase.requestBooking(new RequestBookingCommand(SLOT.startAt(), SLOT.endAt(), "subject-1")))
                .willReturn(confirmed());

        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .header("X-Subject-Id", "subject-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.appointmentId").value(1))
                .andExpect(jsonPath("$.data.subjectId").value("subject-1"))
                .andExpect(jsonPath("$.data.slotStart").value("2025-03-03T09:00:00Z"))
                .andExpect(jsonPath("$.data.status").value("CONFIRMED"));
    }

    @Test
    @DisplayName("슬롯이 마감되면 409와 B003 코드를 반환한다")
    void requestBooking_SlotFull() throws Exception {
        // given
        given(requestBookingUseCase.requestBooking(any())).willThrow(new SlotFullException(SLOT));

        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .header("X-Subject-Id", "subject-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B003"))
                .andExpect(jsonPath("$.message").value("해당 시간의 예약이 마감되었습니다. 다른 시간을 선택해 주세요."));
    }

    @Test
    @DisplayName("예약자 헤더가 없으면 400과 C001 코드를 반환한다")
    void requestBooking_MissingSubjectHeader() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        then(requestBookingUseCase).should(never()).requestBooking(any());
    }

    @Test
    @DisplayName("슬롯 시각이 누락되면 검증 메시지와 함께 400을 반환한다")
    void requestBooking_MissingSlotEnd() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .header("X-Subject-Id", "subject-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotStart\":\"2025-03-03T09:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"))
                .andExpect(jsonPath("$.message").value("슬롯 종료 시각은 필수입니다."));
    }

    @Test
    @DisplayName("예약 취소 성공 시 취소 상태를 반환한다")
    void cancelBooking_Success() throws Exception {
        // given
        given(cancelBookingUseCase.cancelBooking(1L))
                .willReturn(confirmed().cancel(Instant.parse("2025-03-02T00:00:00Z")));

        // when & then
        mockMvc.perform(post("/api/v1/appointments/1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"))
                .andExpect(jsonPath("$.data.cancelledAt").value("2025-03-02T00:00:00Z"));
    }

    @Test
    @DisplayName("이미 취소된 예약을 다시 취소하면 409와 B005 코드를 반환한다")
    void cancelBooking_AlreadyCancelled() throws Exception {
        // given
        given(cancelBookingUseCase.cancelBooking(1L)).willThrow(new AlreadyCancelledException(1L));

        // when & then
        mockMvc.perform(post("/api/v1/appointments/1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B005"));
    }

    @Test
    @DisplayName("없는 예약을 조회하면 404와 B004 코드를 반환한다")
    void getAppointment_NotFound() throws Exception {
        // given
        given(getAppointmentUseCase.getAppointment(99L)).willThrow(new AppointmentNotFoundException(99L));

        // when & then
        mockMvc.perform(get("/api/v1/appointments/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("B004"));
    }

    @Test
    @DisplayName("내 예약 목록은 헤더의 예약자로 조회한다")
    void listMyAppointments() throws Exception {
        // given
        given(getAppointmentUseCase.listAppointments("subject-1", null)).willReturn(List.of(confirmed()));

        // when & then
        mockMvc.perform(get("/api/v1/appointments").header("X-Subject-Id", "subject-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.data[0].appointmentId").value(1));
    }
}
