package personal.appointment.scheduling.availability.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.appointment.scheduling.availability.application.port.in.UpdateConfigurationCommand;
import personal.appointment.scheduling.availability.application.port.out.ConfigurationRepository;
import personal.appointment.scheduling.availability.domain.exception.InvalidConfigurationException;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;
import personal.appointment.scheduling.config.AppointmentProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConfigurationStore 단위 테스트")
class ConfigurationStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T00:00:00Z");

    @Mock
    private ConfigurationRepository configurationRepository;

    private ConfigurationStore configurationStore;
    private SchedulingConfiguration current;

    @BeforeEach
    void setUp() {
        AppointmentProperties properties = new AppointmentProperties(
                new AppointmentProperties.Configuration(new AppointmentProperties.Defaults(60, 1, "UTC", 1440)),
                new AppointmentProperties.Availability(62),
                new AppointmentProperties.Booking(10),
                new AppointmentProperties.Outbox(500, 3, 100));
        configurationStore = new ConfigurationStore(configurationRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        current = new SchedulingConfiguration(1L, 30, 2, ZoneId.of("Asia/Seoul"), 60, Instant.EPOCH);
    }

    @Test
    @DisplayName("설정이 있으면 그대로 반환하고 새로 만들지 않는다")
    void getConfiguration_Existing() {
        // given
        given(configurationRepository.findCurrent()).willReturn(Optional.of(current));

        // when
        SchedulingConfiguration result = configurationStore.getConfiguration();

        // then
        assertThat(result).isEqualTo(current);
        verify(configurationRepository, never()).save(any());
    }

    @Test
    @DisplayName("최초 접근 시 기본값으로 설정을 생성한다")
    void getConfiguration_FirstAccess_InitializesDefaults() {
        // given
        given(configurationRepository.findCurrent()).willReturn(Optional.empty());
        given(configurationRepository.save(any())).willAnswer(invocation -> invocation.getArgument(0));

        // when
        SchedulingConfiguration result = configurationStore.getConfiguration();

        // then
        assertThat(result.slotDurationMinutes()).isEqualTo(60);
        assertThat(result.maxAppointmentsPerSlot()).isEqualTo(1);
        assertThat(result.timezone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(result.minBookingLeadMinutes()).isEqualTo(1440);
        assertThat(result.updatedAt()).isEqualTo(NOW);
        verify(configurationRepository).save(any());
    }

    @Test
    @DisplayName("부분 수정은 지정한 필드만 바꾸고 나머지는 유지한다")
    void updateConfiguration_Partial() {
        // given
        given(configurationRepository.findCurrent()).willReturn(Optional.of(current));
        given(configurationRepository.save(any())).willAnswer(invocation -> invocation.getArgument(0));
        ArgumentCaptor<SchedulingConfiguration> captor = ArgumentCaptor.forClass(SchedulingConfiguration.class);

        // when
        SchedulingConfiguration result = configurationStore.updateConfiguration(
                new UpdateConfigurationCommand(45, null, null, null));

        // then
        verify(configurationRepository).save(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo(1L);
        assertThat(result.slotDurationMinutes()).isEqualTo(45);
        assertThat(result.maxAppointmentsPerSlot()).isEqualTo(2);
        assertThat(result.timezone()).isEqualTo(ZoneId.of("Asia/Seoul"));
        assertThat(result.minBookingLeadMinutes()).isEqualTo(60);
        assertThat(result.updatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("알 수 없는 타임존이면 아무것도 저장하지 않고 실패한다")
    void updateConfiguration_UnknownTimezone_Rejected() {
        // given
        given(configurationRepository.findCurrent()).willReturn(Optional.of(current));

        // when & then
        assertThatThrownBy(() -> configurationStore.updateConfiguration(
                new UpdateConfigurationCommand(15, null, "Mars/Olympus_Mons", null)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Mars/Olympus_Mons");
        verify(configurationRepository, never()).save(any());
    }

    @Test
    @DisplayName("슬롯 길이 0, 용량 0, 음수 리드타임은 거부한다")
    void updateConfiguration_InvalidNumbers_Rejected() {
        // given
        given(configurationRepository.findCurrent()).willReturn(Optional.of(current));

        // when & then
        assertThatThrownBy(() -> configurationStore.updateConfiguration(new UpdateConfigurationCommand(0, null, null, null)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> configurationStore.updateConfiguration(new UpdateConfigurationCommand(null, 0, null, null)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> configurationStore.updateConfiguration(new UpdateConfigurationCommand(null, null, null, -1)))
                .isInstanceOf(InvalidConfigurationException.class);
        verify(configurationRepository, never()).save(any());
    }
}
