package personal.appointment.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import personal.appointment.scheduling.config.AppointmentProperties;

/**
 * Scheduling Service Application
 * 가용 시간 규칙으로 슬롯을 계산하고 용량 내에서 예약을 확정하는 서비스
 */
@EnableScheduling  // Outbox Scheduler 활성화
@EnableConfigurationProperties(AppointmentProperties.class)
@SpringBootApplication(
    scanBasePackages = {
        "personal.appointment.scheduling",
        "personal.appointment.common"  // common 모듈의 GlobalExceptionHandler 스캔
    }
)
public class SchedulingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
