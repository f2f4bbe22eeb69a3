package personal.appointment.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.appointment.scheduling.availability.application.port.in.LoadAvailabilitySnapshotUseCase;
import personal.appointment.scheduling.availability.domain.exception.InvalidWindowException;
import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.availability.domain.model.TimeSlot;
import personal.appointment.scheduling.availability.domain.service.SlotGenerator;
import personal.appointment.scheduling.booking.application.port.in.CancelBookingUseCase;
import personal.appointment.scheduling.booking.application.port.in.ListAvailableSlotsUseCase;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingCommand;
import personal.appointment.scheduling.booking.application.port.in.RequestBookingUseCase;
import personal.appointment.scheduling.booking.application.port.out.BookingLockRepository;
import personal.appointment.scheduling.booking.domain.exception.BookingInProgressException;
import personal.appointment.scheduling.booking.domain.exception.SlotUnavailableException;
import personal.appointment.scheduling.booking.domain.model.Appointment;
import personal.appointment.scheduling.booking.domain.model.SlotAvailability;
import personal.appointment.scheduling.booking.domain.service.BookingLedger;
import personal.appointment.scheduling.config.AppointmentProperties;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appointment Scheduler
 * 슬롯 생성 결과와 예약 원장을 합쳐 조회하고, 예약/취소 요청을 원장에 위임한다.
 * <p>
 * 목록 조회는 설정 최초 생성 가능성 때문에 읽기 전용 트랜잭션으로 감싸지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentScheduler implements ListAvailableSlotsUseCase, RequestBookingUseCase, CancelBookingUseCase {

    private final LoadAvailabilitySnapshotUseCase loadAvailabilitySnapshotUseCase;
    private final SlotGenerator slotGenerator;
    private final BookingLedger bookingLedger;
    private final BookingLockRepository bookingLockRepository;
    private final AppointmentProperties appointmentProperties;
    private final Clock clock;

    @Override
    public List<SlotAvailability> listAvailableSlots(LocalDate from, LocalDate to) {
        return listSlots(from, to).stream()
                .filter(SlotAvailability::isBookable)
                .toList();
    }

    @Override
    public List<SlotAvailability> listAllSlots(LocalDate from, LocalDate to) {
        return listSlots(from, to);
    }

    @Override
    public Appointment requestBooking(RequestBookingCommand command) {
        SlotKey slot = command.slotKey();

        // 정렬되지 않은 구간은 원장까지 가지 않고 바로 거절
        AvailabilitySnapshot snapshot = loadAvailabilitySnapshotUseCase.loadSnapshotAt(slot.startAt());
        if (slotGenerator.find(snapshot, slot).isEmpty()) {
            log.warn("Requested bounds are not a slot: slot={}", slot);
            throw new SlotUnavailableException(slot);
        }

        String owner = UUID.randomUUID().toString();
        boolean locked = bookingLockRepository.tryLock(slot, command.subjectId(), owner,
                appointmentProperties.booking().lockTtlSeconds());
        if (!locked) {
            log.warn("Booking already in progress: slot={}, subjectId={}", slot, command.subjectId());
            throw new BookingInProgressException(slot, command.subjectId());
        }

        try {
            return bookingLedger.book(slot, command.subjectId());
        } finally {
            bookingLockRepository.unlock(slot, command.subjectId(), owner);
        }
    }

    @Override
    public Appointment cancelBooking(Long appointmentId) {
        return bookingLedger.cancel(appointmentId);
    }

    private List<SlotAvailability> listSlots(LocalDate from, LocalDate to) {
        validateWindow(from, to);

        AvailabilitySnapshot snapshot = loadAvailabilitySnapshotUseCase.loadSnapshot(from, to);
        List<TimeSlot> slots = slotGenerator.generate(snapshot, from, to, clock.instant()).toList();
        if (slots.isEmpty()) {
            return List.of();
        }

        Map<SlotKey, Integer> bookedCounts = bookingLedger.bookedCounts(
                slots.get(0).startAt(), slots.get(slots.size() - 1).endAt());

        return slots.stream()
                .map(slot -> SlotAvailability.of(slot, bookedCounts.getOrDefault(slot.key(), 0)))
                .toList();
    }

    private void validateWindow(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new InvalidWindowException(String.format("Window end precedes start: %s ~ %s", from, to));
        }
        int maxWindowDays = appointmentProperties.availability().maxWindowDays();
        if (ChronoUnit.DAYS.between(from, to) + 1 > maxWindowDays) {
            throw new InvalidWindowException(
                    String.format("Window exceeds %d days: %s ~ %s", maxWindowDays, from, to));
        }
    }
}
