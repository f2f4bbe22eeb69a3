package personal.appointment.scheduling.availability.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.application.port.out.ExceptionDateRepository;
import personal.appointment.scheduling.availability.domain.exception.DuplicateExceptionDateException;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.LocalDate;
import java.util.List;

/**
 * Exception Date Persistence Adapter
 * JPA를 사용한 예외 날짜 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExceptionDatePersistenceAdapter implements ExceptionDateRepository {

    private final JpaExceptionDateRepository jpaExceptionDateRepository;

    @Override
    public ExceptionDate save(ExceptionDate exceptionDate) {
        try {
            var saved = jpaExceptionDateRepository.saveAndFlush(ExceptionDateEntity.fromDomain(exceptionDate));
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            // 동시 등록 시 유니크 인덱스 위반
            log.warn("Concurrent exception date registration detected: date={}", exceptionDate.date());
            throw new DuplicateExceptionDateException(exceptionDate.date());
        }
    }

    @Override
    public boolean existsByDate(LocalDate date) {
        return jpaExceptionDateRepository.existsByDate(date);
    }

    @Override
    public int deleteByDate(LocalDate date) {
        return jpaExceptionDateRepository.deleteByDate(date);
    }

    @Override
    public List<ExceptionDate> findBetween(LocalDate from, LocalDate to) {
        return jpaExceptionDateRepository.findByDateBetweenOrderByDateAsc(from, to).stream()
                .map(ExceptionDateEntity::toDomain)
                .toList();
    }
}
