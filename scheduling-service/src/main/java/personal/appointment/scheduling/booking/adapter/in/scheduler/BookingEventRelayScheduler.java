package personal.appointment.scheduling.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.booking.application.port.in.RelayPendingEventsUseCase;
import personal.appointment.scheduling.booking.application.port.in.RelayPendingEventsUseCase.RelayResult;

/**
 * Booking Event Relay Scheduler (Driving Adapter)
 * 이전 배치가 끝난 뒤 appointment.outbox.publish-delay-ms 간격으로 Outbox 배치를 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventRelayScheduler {

    private final RelayPendingEventsUseCase relayPendingEventsUseCase;

    @Scheduled(fixedDelayString = "${appointment.outbox.publish-delay-ms}")
    public void relay() {
        RelayResult result = relayPendingEventsUseCase.relayPendingEvents();
        if (result.isEmpty()) {
            return;
        }
        if (result.failed() > 0) {
            log.warn("Outbox batch relayed with failures: {}", result);
        } else {
            log.debug("Outbox batch relayed: {}", result);
        }
    }
}
