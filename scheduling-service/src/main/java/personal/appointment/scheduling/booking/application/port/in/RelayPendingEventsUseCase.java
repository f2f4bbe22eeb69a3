package personal.appointment.scheduling.booking.application.port.in;

/**
 * Relay Pending Events UseCase (Input Port)
 * Outbox 테이블의 PENDING 이벤트를 한 배치씩 메시지 브로커로 전달
 */
public interface RelayPendingEventsUseCase {

    RelayResult relayPendingEvents();

    /**
     * 한 배치의 처리 결과
     *
     * @param published 발행 완료
     * @param retrying  실패했지만 다음 배치에서 재시도
     * @param failed    이번 배치에서 FAILED로 전이
     */
    record RelayResult(int published, int retrying, int failed) {

        public static final RelayResult EMPTY = new RelayResult(0, 0, 0);

        public boolean isEmpty() {
            return published == 0 && retrying == 0 && failed == 0;
        }
    }
}
