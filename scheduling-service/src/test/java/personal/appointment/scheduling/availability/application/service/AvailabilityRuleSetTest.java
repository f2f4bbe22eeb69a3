package personal.appointment.scheduling.availability.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.appointment.scheduling.availability.application.port.in.AddAvailabilityRuleCommand;
import personal.appointment.scheduling.availability.application.port.in.UpdateAvailabilityRuleCommand;
import personal.appointment.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.appointment.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException;
import personal.appointment.scheduling.availability.domain.exception.InvalidRuleException;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityRuleSet 단위 테스트")
class AvailabilityRuleSetTest {

    private static final Instant NOW = Instant.parse("2025-03-01T00:00:00Z");
    private static final Long RULE_ID = 7L;

    @Mock
    private AvailabilityRuleRepository availabilityRuleRepository;

    private AvailabilityRuleSet availabilityRuleSet;
    private AvailabilityRule existing;

    @BeforeEach
    void setUp() {
        availabilityRuleSet = new AvailabilityRuleSet(availabilityRuleRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        existing = new AvailabilityRule(RULE_ID, DayOfWeek.MONDAY, LocalTime.of(9, 0), LocalTime.of(11, 0),
                true, true, Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    @DisplayName("규칙 등록 성공 - 기본값은 활성, 반복")
    void addRule_Success() {
        // given
        given(availabilityRuleRepository.save(any())).willAnswer(invocation -> invocation.getArgument(0));

        // when
        AvailabilityRule result = availabilityRuleSet.addRule(
                AddAvailabilityRuleCommand.of(DayOfWeek.FRIDAY, LocalTime.of(13, 0), LocalTime.of(17, 0)));

        // then
        assertThat(result.weekday()).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(result.active()).isTrue();
        assertThat(result.recurring()).isTrue();
        assertThat(result.createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("종료 시각이 시작 시각보다 늦지 않으면 등록 실패")
    void addRule_EndNotAfterStart_Rejected() {
        // when & then
        assertThatThrownBy(() -> availabilityRuleSet.addRule(
                AddAvailabilityRuleCommand.of(DayOfWeek.FRIDAY, LocalTime.of(13, 0), LocalTime.of(13, 0))))
                .isInstanceOf(InvalidRuleException.class);
        verify(availabilityRuleRepository, never()).save(any());
    }

    @Test
    @DisplayName("부분 수정은 병합된 구간으로 다시 검증한다")
    void updateRule_MergedIntervalInvalid_Rejected() {
        // given
        given(availabilityRuleRepository.findById(RULE_ID)).willReturn(Optional.of(existing));

        // when & then: 기존 종료 11:00 보다 늦은 시작
        assertThatThrownBy(() -> availabilityRuleSet.updateRule(RULE_ID,
                new UpdateAvailabilityRuleCommand(null, LocalTime.of(12, 0), null, null, null)))
                .isInstanceOf(InvalidRuleException.class);
        verify(availabilityRuleRepository, never()).save(any());
    }

    @Test
    @DisplayName("부분 수정 성공 - 비활성화")
    void updateRule_Deactivate() {
        // given
        given(availabilityRuleRepository.findById(RULE_ID)).willReturn(Optional.of(existing));
        given(availabilityRuleRepository.save(any())).willAnswer(invocation -> invocation.getArgument(0));

        // when
        AvailabilityRule result = availabilityRuleSet.updateRule(RULE_ID,
                new UpdateAvailabilityRuleCommand(null, null, null, false, null));

        // then
        assertThat(result.active()).isFalse();
        assertThat(result.startTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(result.createdAt()).isEqualTo(Instant.EPOCH);
        assertThat(result.updatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("없는 규칙 삭제 시 NotFound")
    void removeRule_NotFound() {
        // given
        given(availabilityRuleRepository.findById(RULE_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> availabilityRuleSet.removeRule(RULE_ID))
                .isInstanceOf(AvailabilityRuleNotFoundException.class)
                .hasMessageContaining(String.valueOf(RULE_ID));
        verify(availabilityRuleRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("규칙 삭제 성공")
    void removeRule_Success() {
        // given
        given(availabilityRuleRepository.findById(RULE_ID)).willReturn(Optional.of(existing));

        // when
        availabilityRuleSet.removeRule(RULE_ID);

        // then
        verify(availabilityRuleRepository).deleteById(RULE_ID);
    }
}
