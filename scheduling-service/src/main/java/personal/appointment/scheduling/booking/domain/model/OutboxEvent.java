package personal.appointment.scheduling.booking.domain.model;

import java.time.Instant;

/**
 * Outbox Event Domain Model
 * 트랜잭션 아웃박스에 저장된 발행 대기 이벤트 (불변)
 * 재시도 한도는 설정값으로 주어지며 모델은 보관하지 않는다.
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        Instant createdAt,
        Instant publishedAt,
        int retryCount) {

    public OutboxEvent markAsPublished(Instant now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount);
    }

    /**
     * 발행 실패 1회 기록. 누적 실패가 maxRetryCount에 도달하면 FAILED로 전이한다.
     */
    public OutboxEvent recordFailure(int maxRetryCount) {
        int attempts = retryCount + 1;
        OutboxEventStatus next = attempts >= maxRetryCount ? OutboxEventStatus.FAILED : status;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, attempts);
    }

    /**
     * 재시도해도 발행할 수 없는 이벤트 (예: 알 수 없는 타입)
     */
    public OutboxEvent markAsFailed() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.FAILED, createdAt, publishedAt, retryCount);
    }

    public boolean isFailed() {
        return status == OutboxEventStatus.FAILED;
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 재시도 초과 또는 발행 불가
    }
}
