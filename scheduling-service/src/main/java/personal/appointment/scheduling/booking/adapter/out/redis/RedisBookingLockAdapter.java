package personal.appointment.scheduling.booking.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.booking.application.port.out.BookingLockRepository;

import java.time.Duration;
import java.util.Collections;

/**
 * Redis Booking Lock Adapter
 * Redis SETNX 기반 중복 제출 방지 락 구현체
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisBookingLockAdapter implements BookingLockRepository {

    private static final String BOOKING_LOCK_PREFIX = "booking:lock:";
    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;

    @Override
    public boolean tryLock(SlotKey slot, String subjectId, String owner, int ttlSeconds) {
        String key = lockKey(slot, subjectId);

        // SETNX + TTL 원자적 수행
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, owner, Duration.ofSeconds(ttlSeconds));

        boolean locked = Boolean.TRUE.equals(success);
        log.debug("Booking lock attempt: key={}, success={}", key, locked);
        return locked;
    }

    @Override
    public void unlock(SlotKey slot, String subjectId, String owner) {
        String key = lockKey(slot, subjectId);

        try {
            Long result = redisTemplate.execute(releaseLockScript, Collections.singletonList(key), owner);

            if (result != null && result == 1L) {
                log.debug("Booking lock released: key={}", key);
            } else {
                log.warn("Failed to release booking lock (not owned or expired): key={}", key);
            }
        } catch (Exception e) {
            // 해제 실패는 TTL 만료로 정리되므로 예약 결과를 바꾸지 않는다
            log.error("Error releasing booking lock: key={}", key, e);
        }
    }

    private String lockKey(SlotKey slot, String subjectId) {
        return BOOKING_LOCK_PREFIX + slot.startAt().getEpochSecond() + ":" + slot.endAt().getEpochSecond() + ":" + subjectId;
    }
}
