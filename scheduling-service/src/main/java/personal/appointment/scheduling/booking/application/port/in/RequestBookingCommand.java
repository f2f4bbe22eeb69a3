package personal.appointment.scheduling.booking.application.port.in;

import personal.appointment.scheduling.availability.domain.model.SlotKey;

import java.time.Instant;

/**
 * Request Booking Command
 */
public record RequestBookingCommand(
        Instant slotStart,
        Instant slotEnd,
        String subjectId
) {
    public SlotKey slotKey() {
        return new SlotKey(slotStart, slotEnd);
    }
}
