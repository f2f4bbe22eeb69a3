package personal.appointment.scheduling.booking.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.appointment.scheduling.booking.application.port.out.AppointmentRepository;
import personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentQueryService 단위 테스트")
class AppointmentQueryServiceTest {

    @Mock
    private AppointmentRepository appointmentRepository;
    @InjectMocks
    private AppointmentQueryService appointmentQueryService;

    private final Appointment appointment = new Appointment(1L,
            Instant.parse("2025-03-03T09:00:00Z"), Instant.parse("2025-03-03T10:00:00Z"),
            "subject-1", AppointmentStatus.CONFIRMED, Instant.EPOCH, null);

    @Test
    @DisplayName("예약 조회 성공")
    void getAppointment_Success() {
        // given
        given(appointmentRepository.findById(1L)).willReturn(Optional.of(appointment));

        // when
        Appointment result = appointmentQueryService.getAppointment(1L);

        // then
        assertThat(result).isEqualTo(appointment);
    }

    @Test
    @DisplayName("예약 조회 실패 - 예약 없음")
    void getAppointment_NotFound() {
        // given
        given(appointmentRepository.findById(1L)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> appointmentQueryService.getAppointment(1L))
                .isInstanceOf(AppointmentNotFoundException.class);
    }

    @Test
    @DisplayName("필터 조건을 그대로 저장소에 전달한다")
    void listAppointments_PassesFilters() {
        // given
        given(appointmentRepository.findAll("subject-1", AppointmentStatus.CONFIRMED)).willReturn(List.of(appointment));

        // when
        List<Appointment> result = appointmentQueryService.listAppointments("subject-1", AppointmentStatus.CONFIRMED);

        // then
        assertThat(result).containsExactly(appointment);
    }
}
