package personal.appointment.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.appointment.scheduling.availability.application.port.in.ManageExceptionDateUseCase;
import personal.appointment.scheduling.availability.application.port.out.ExceptionDateRepository;
import personal.appointment.scheduling.availability.domain.exception.DuplicateExceptionDateException;
import personal.appointment.scheduling.availability.domain.exception.ExceptionDateNotFoundException;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Exception Calendar
 * 슬롯 생성에서 제외할 특정 날짜 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ExceptionCalendar implements ManageExceptionDateUseCase {

    private final ExceptionDateRepository exceptionDateRepository;
    private final Clock clock;

    @Override
    @Transactional
    public ExceptionDate addExceptionDate(LocalDate date, String reason) {
        if (date != null && exceptionDateRepository.existsByDate(date)) {
            log.warn("Exception date already registered: date={}", date);
            throw new DuplicateExceptionDateException(date);
        }

        ExceptionDate saved = exceptionDateRepository.save(ExceptionDate.create(date, reason, clock.instant()));
        log.info("Exception date added: date={}, reason={}", saved.date(), saved.reason());
        return saved;
    }

    @Override
    @Transactional
    public void removeExceptionDate(LocalDate date) {
        int deleted = exceptionDateRepository.deleteByDate(date);
        if (deleted == 0) {
            log.warn("Exception date not found for removal: date={}", date);
            throw new ExceptionDateNotFoundException(date);
        }
        log.info("Exception date removed: date={}", date);
    }

    @Override
    public boolean isExceptionDate(LocalDate date) {
        return exceptionDateRepository.existsByDate(date);
    }

    @Override
    public List<ExceptionDate> listExceptionDates(LocalDate from, LocalDate to) {
        return exceptionDateRepository.findBetween(from, to);
    }
}
