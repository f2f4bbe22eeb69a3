package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Load Availability Snapshot UseCase (Input Port)
 * 슬롯 생성 입력(설정, 활성 규칙, 예외 날짜)을 요청 시점 기준으로 읽어온다.
 * 캐시하지 않으므로 규칙/설정 변경은 다음 호출에 바로 반영된다.
 */
public interface LoadAvailabilitySnapshotUseCase {

    /**
     * 날짜 구간용 스냅샷
     */
    AvailabilitySnapshot loadSnapshot(LocalDate from, LocalDate to);

    /**
     * 특정 시각이 속한 (설정 타임존 기준) 날짜용 스냅샷
     */
    AvailabilitySnapshot loadSnapshotAt(Instant instant);
}
