package personal.appointment.scheduling.availability.domain.model;

import personal.appointment.scheduling.availability.domain.exception.InvalidConfigurationException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Scheduling Configuration Domain Model
 * 전역 예약 설정 도메인 모델 (불변, 프로세스 전체에서 하나만 존재)
 */
public record SchedulingConfiguration(
        Long id,
        int slotDurationMinutes,
        int maxAppointmentsPerSlot,
        ZoneId timezone,
        int minBookingLeadMinutes,
        Instant updatedAt) {
    public SchedulingConfiguration {
        if (slotDurationMinutes <= 0) {
            throw new InvalidConfigurationException("slotDurationMinutes must be greater than 0 but was " + slotDurationMinutes);
        }
        if (maxAppointmentsPerSlot < 1) {
            throw new InvalidConfigurationException("maxAppointmentsPerSlot must be at least 1 but was " + maxAppointmentsPerSlot);
        }
        if (timezone == null) {
            throw new InvalidConfigurationException("timezone cannot be null");
        }
        if (minBookingLeadMinutes < 0) {
            throw new InvalidConfigurationException("minBookingLeadMinutes cannot be negative but was " + minBookingLeadMinutes);
        }
        if (updatedAt == null) {
            throw new InvalidConfigurationException("updatedAt cannot be null");
        }
    }

    /**
     * 최초 접근 시 생성되는 기본 설정
     */
    public static SchedulingConfiguration initial(int slotDurationMinutes,
                                                  int maxAppointmentsPerSlot,
                                                  String timezone,
                                                  int minBookingLeadMinutes,
                                                  Instant now) {
        return new SchedulingConfiguration(
                null,
                slotDurationMinutes,
                maxAppointmentsPerSlot,
                resolveZone(timezone),
                minBookingLeadMinutes,
                now);
    }

    /**
     * 부분 수정 (null 필드는 기존 값 유지)
     * 병합된 후보 값 전체를 검증한 뒤에만 새 인스턴스를 반환하므로 일부만 반영되는 일은 없다.
     */
    public SchedulingConfiguration update(Integer slotDurationMinutes,
                                          Integer maxAppointmentsPerSlot,
                                          String timezone,
                                          Integer minBookingLeadMinutes,
                                          Instant now) {
        return new SchedulingConfiguration(
                id,
                slotDurationMinutes != null ? slotDurationMinutes : this.slotDurationMinutes,
                maxAppointmentsPerSlot != null ? maxAppointmentsPerSlot : this.maxAppointmentsPerSlot,
                timezone != null ? resolveZone(timezone) : this.timezone,
                minBookingLeadMinutes != null ? minBookingLeadMinutes : this.minBookingLeadMinutes,
                now);
    }

    public Duration slotDuration() {
        return Duration.ofMinutes(slotDurationMinutes);
    }

    public Duration minBookingLead() {
        return Duration.ofMinutes(minBookingLeadMinutes);
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidConfigurationException("timezone cannot be blank");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("unknown timezone '" + timezone + "'");
        }
    }
}
