package personal.appointment.scheduling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Appointment 설정 Properties
 * application.yml의 appointment.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "appointment")
public record AppointmentProperties(
        Configuration configuration,
        Availability availability,
        Booking booking,
        Outbox outbox
) {
    public record Configuration(
            Defaults defaults
    ) {}

    /**
     * 최초 접근 시 생성되는 전역 설정의 기본값
     */
    public record Defaults(
            int slotDurationMinutes,
            int maxAppointmentsPerSlot,
            String timezone,
            int minBookingLeadMinutes
    ) {}

    public record Availability(
            int maxWindowDays  // 한 번에 조회할 수 있는 최대 일수
    ) {}

    public record Booking(
            int lockTtlSeconds  // 동일 요청 중복 제출 방지 락 TTL
    ) {}

    /**
     * Outbox 전달 배치 설정
     */
    public record Outbox(
            long publishDelayMs,  // 이전 배치 종료 후 다음 배치까지 대기
            int maxRetryCount,    // 누적 실패가 이 값에 도달하면 FAILED
            int batchSize         // 한 배치에서 읽을 최대 이벤트 수
    ) {}
}
