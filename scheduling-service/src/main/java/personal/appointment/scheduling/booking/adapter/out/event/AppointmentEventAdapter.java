package personal.appointment.scheduling.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.booking.adapter.out.persistence.JpaOutboxEventRepository;
import personal.appointment.scheduling.booking.adapter.out.persistence.OutboxEventEntity;
import personal.appointment.scheduling.booking.adapter.out.persistence.OutboxEventFactory;
import personal.appointment.scheduling.booking.application.port.out.AppointmentEventPort;
import personal.appointment.scheduling.booking.domain.model.Appointment;

/**
 * Appointment Event Adapter
 * Outbox 패턴을 사용한 예약 이벤트 기록 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentEventAdapter implements AppointmentEventPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishAppointmentEvent(Appointment appointment) {
        OutboxEventEntity outboxEvent = outboxEventFactory.create(appointment);

        jpaOutboxEventRepository.save(outboxEvent);
        log.debug("Appointment event recorded: appointmentId={}, status={}",
                appointment.id(), appointment.status());
    }
}
