package personal.appointment.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.availability.application.port.in.LoadAvailabilitySnapshotUseCase;
import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.availability.domain.model.TimeSlot;
import personal.appointment.scheduling.availability.domain.service.SlotGenerator;
import personal.appointment.scheduling.booking.application.port.out.AppointmentRepository;
import personal.appointment.scheduling.booking.application.port.out.SlotCounterRepository;
import personal.appointment.scheduling.booking.domain.exception.AppointmentNotFoundException;
import personal.appointment.scheduling.booking.domain.exception.DuplicateBookingException;
import personal.appointment.scheduling.booking.domain.exception.SlotExpiredException;
import personal.appointment.scheduling.booking.domain.exception.SlotFullException;
import personal.appointment.scheduling.booking.domain.exception.SlotUnavailableException;
import personal.appointment.scheduling.booking.domain.model.Appointment;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Booking Ledger (Domain Service)
 * 슬롯별 확정 예약 수를 관리하는 원장. 용량 검사와 증가를 하나의 트랜잭션에서 수행한다.
 * <p>
 * 같은 슬롯에 대한 동시 예약은 슬롯 카운터 행의 조건부 UPDATE가 잡는 DB 행 락으로 직렬화되므로
 * 어떤 시점에도 CONFIRMED 예약 수가 용량을 넘지 않는다.
 * Outbox 기록은 AppointmentRepository Adapter 내부에서 수행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLedger {

    private final LoadAvailabilitySnapshotUseCase loadAvailabilitySnapshotUseCase;
    private final SlotGenerator slotGenerator;
    private final AppointmentRepository appointmentRepository;
    private final SlotCounterRepository slotCounterRepository;
    private final Clock clock;

    /**
     * 슬롯 예약 확정
     * 1. 최신 규칙/설정으로 슬롯 재검증
     * 2. 최소 예약 리드타임 검증
     * 3. 같은 예약자의 중복 예약 검증
     * 4. 조건부 증가 (bookedCount < capacity)
     * 5. CONFIRMED 예약 저장 (+ BOOKING_CONFIRMED 이벤트)
     */
    @Transactional
    public Appointment book(SlotKey slot, String subjectId) {
        Instant now = clock.instant();
        AvailabilitySnapshot snapshot = loadAvailabilitySnapshotUseCase.loadSnapshotAt(slot.startAt());

        TimeSlot timeSlot = slotGenerator.find(snapshot, slot)
                .orElseThrow(() -> {
                    log.warn("Slot no longer offered: slot={}", slot);
                    return new SlotUnavailableException(slot);
                });

        if (timeSlot.startAt().isBefore(now.plus(snapshot.configuration().minBookingLead()))) {
            log.warn("Slot within booking lead time: slot={}", slot);
            throw new SlotExpiredException(slot);
        }

        if (appointmentRepository.existsConfirmed(slot, subjectId)) {
            log.warn("Duplicate booking: slot={}, subjectId={}", slot, subjectId);
            throw new DuplicateBookingException(slot, subjectId);
        }

        if (!slotCounterRepository.tryIncrement(slot, timeSlot.capacity())) {
            log.warn("Slot full: slot={}, capacity={}", slot, timeSlot.capacity());
            throw new SlotFullException(slot);
        }

        Appointment appointment = appointmentRepository.save(Appointment.confirm(slot, subjectId, now));
        log.info("Booking confirmed: appointmentId={}, slot={}, subjectId={}",
                appointment.id(), slot, subjectId);
        return appointment;
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED) 후 슬롯 용량 반환
     * 예약 행을 비관적 락으로 잡아 이중 취소를 막는다.
     */
    @Transactional
    public Appointment cancel(Long appointmentId) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> {
                    log.warn("Appointment not found: appointmentId={}", appointmentId);
                    return new AppointmentNotFoundException(appointmentId);
                });

        Appointment cancelled = appointmentRepository.save(appointment.cancel(clock.instant()));
        slotCounterRepository.release(cancelled.slotKey());

        log.info("Booking cancelled: appointmentId={}, slot={}", appointmentId, cancelled.slotKey());
        return cancelled;
    }

    /**
     * 시작 시각이 [from, to) 인 슬롯들의 현재 예약 수
     */
    @Transactional(readOnly = true)
    public Map<SlotKey, Integer> bookedCounts(Instant from, Instant to) {
        return slotCounterRepository.bookedCounts(from, to);
    }
}
