package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Manage Availability Block UseCase (Input Port)
 * 특정 날짜에만 추가로 여는 가용 시간 관리 (관리자 전용)
 * <p>
 * 같은 날의 규칙이나 다른 블록과 겹쳐도 거부하지 않는다. 슬롯 생성 시 겹치는 구간끼리 병합된다.
 */
public interface ManageAvailabilityBlockUseCase {

    /**
     * @throws personal.appointment.scheduling.availability.domain.exception.InvalidAvailabilityBlockException endTime <= startTime 일 때
     */
    AvailabilityBlock addBlock(LocalDate date, LocalTime startTime, LocalTime endTime);

    /**
     * @throws personal.appointment.scheduling.availability.domain.exception.AvailabilityBlockNotFoundException 블록이 없을 때
     */
    void removeBlock(Long blockId);

    /**
     * 기간 내 블록 목록 (날짜, 시작 시각 오름차순)
     */
    List<AvailabilityBlock> listBlocks(LocalDate from, LocalDate to);
}
