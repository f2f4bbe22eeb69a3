package personal.appointment.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.availability.application.port.in.ManageAvailabilityBlockUseCase;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityBlockRepository;
import personal.appointment.scheduling.availability.domain.exception.AvailabilityBlockNotFoundException;
import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Availability Block Calendar
 * 날짜 단위 추가 가용 시간 관리. 예외 날짜와 반대로 특정 날에 슬롯을 더한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityBlockCalendar implements ManageAvailabilityBlockUseCase {

    private final AvailabilityBlockRepository availabilityBlockRepository;
    private final Clock clock;

    @Override
    @Transactional
    public AvailabilityBlock addBlock(LocalDate date, LocalTime startTime, LocalTime endTime) {
        AvailabilityBlock saved = availabilityBlockRepository.save(
                AvailabilityBlock.create(date, startTime, endTime, clock.instant()));
        log.info("Availability block added: blockId={}, date={}, {}-{}",
                saved.id(), saved.date(), saved.startTime(), saved.endTime());
        return saved;
    }

    @Override
    @Transactional
    public void removeBlock(Long blockId) {
        AvailabilityBlock block = availabilityBlockRepository.findById(blockId)
                .orElseThrow(() -> {
                    log.warn("Availability block not found: blockId={}", blockId);
                    return new AvailabilityBlockNotFoundException(blockId);
                });
        availabilityBlockRepository.deleteById(block.id());
        log.info("Availability block removed: blockId={}, date={}", blockId, block.date());
    }

    @Override
    public List<AvailabilityBlock> listBlocks(LocalDate from, LocalDate to) {
        return availabilityBlockRepository.findBetween(from, to);
    }
}
