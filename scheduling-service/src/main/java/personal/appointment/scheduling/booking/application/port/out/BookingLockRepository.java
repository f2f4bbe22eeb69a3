package personal.appointment.scheduling.booking.application.port.out;

import personal.appointment.scheduling.availability.domain.model.SlotKey;

/**
 * Booking Lock Repository (Output Port)
 * Redis SETNX 기반 중복 제출 방지 락
 */
public interface BookingLockRepository {

    /**
     * 락 획득 시도 (Fail-Fast: 대기하지 않음)
     *
     * @return true: 획득 성공, false: 같은 요청이 처리 중
     */
    boolean tryLock(SlotKey slot, String subjectId, String owner, int ttlSeconds);

    /**
     * 소유자가 일치할 때만 해제 (Lua Script)
     */
    void unlock(SlotKey slot, String subjectId, String owner);
}
