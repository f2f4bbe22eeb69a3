package personal.appointment.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock Configuration
 * 현재 시각은 외부 협력자로 취급하여 Bean으로 주입 (테스트에서 고정 시각 사용)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
