package personal.appointment.scheduling.booking.application.port.out;

/**
 * Booking Event Publisher (Output Port)
 * Kafka 이벤트 발행 인터페이스
 */
public interface BookingEventPublisher {

    /**
     * 직렬화된 JSON Payload를 그대로 발행
     *
     * @param topic   Kafka 토픽
     * @param key     메시지 키 (appointmentId, 순서 보장용)
     * @param payload 메시지 본문
     */
    void publishRaw(String topic, String key, String payload);
}
