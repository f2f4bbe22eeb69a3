package personal.appointment.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.booking.application.port.in.GetAppointmentUseCase;
import personal.appointment.scheduling.booking.application.port.out.AppointmentRepository;
import personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.AppointmentStatus;

import java.util.List;

/**
 * Appointment Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AppointmentQueryService implements GetAppointmentUseCase {

    private final AppointmentRepository appointmentRepository;

    @Override
    public Appointment getAppointment(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> {
                    log.warn("Appointment not found: appointmentId={}", appointmentId);
                    return new AppointmentNotFoundException(appointmentId);
                });
    }

    @Override
    public List<Appointment> listAppointments(String subjectId, AppointmentStatus status) {
        return appointmentRepository.findAll(subjectId, status);
    }
}
