package personal.appointment.scheduling.booking.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration
 */
@Configuration
public class RedisConfig {

    /**
     * 값이 일치할 때만 삭제하는 락 해제 스크립트
     */
    @Bean
    public RedisScript<Long> releaseLockScript() {
        return RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class);
    }
}
