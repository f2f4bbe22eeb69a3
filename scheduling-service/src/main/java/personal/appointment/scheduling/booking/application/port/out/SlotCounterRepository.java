package personal.appointment.scheduling.booking.application.port.out;

import personal.appointment.scheduling.availability.domain.model.SlotKey;

import java.time.Instant;
import java.util.Map;

/**
 * Slot Counter Repository (Output Port)
 * 슬롯별 확정 예약 수 원장
 */
public interface SlotCounterRepository {

    /**
     * 예약 수가 용량보다 작을 때만 1 증가 (원자적)
     * 같은 슬롯에 대한 동시 요청은 DB 행 락으로 직렬화된다.
     *
     * @return true: 증가 성공, false: 용량 초과
     */
    boolean tryIncrement(SlotKey slot, int capacity);

    /**
     * 예약 수 1 감소 (0 미만으로 내려가지 않음)
     */
    void release(SlotKey slot);

    /**
     * 시작 시각이 [from, to) 인 슬롯들의 현재 예약 수
     */
    Map<SlotKey, Integer> bookedCounts(Instant from, Instant to);
}
