package personal.appointment.scheduling.availability.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import personal.appointment.scheduling.availability.domain.model.AvailabilityBlock;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;
import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.availability.domain.model.SlotSequence;
import personal.appointment.scheduling.availability.domain.model.TimeSlot;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlotGenerator 단위 테스트")
class SlotGeneratorTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 3);
    private static final Instant BEFORE_WINDOW = Instant.parse("2025-03-01T00:00:00Z");

    private final SlotGenerator slotGenerator = new SlotGenerator();

    private static SchedulingConfiguration configuration(int slotMinutes, int maxPerSlot, String zone, int leadMinutes) {
        return new SchedulingConfiguration(1L, slotMinutes, maxPerSlot, ZoneId.of(zone), leadMinutes, Instant.EPOCH);
    }

    private static AvailabilityRule rule(DayOfWeek weekday, String start, String end) {
        return new AvailabilityRule(null, weekday, LocalTime.parse(start), LocalTime.parse(end),
                true, true, Instant.EPOCH, Instant.EPOCH);
    }

    private static AvailabilitySnapshot snapshot(SchedulingConfiguration configuration, AvailabilityRule... rules) {
        return new AvailabilitySnapshot(configuration, List.of(rules), Set.of());
    }

    private static List<Instant> starts(List<TimeSlot> slots) {
        return slots.stream().map(TimeSlot::startAt).toList();
    }

    @Nested
    @DisplayName("슬롯 분할")
    class Tiling {

        @Test
        @DisplayName("월요일 09:00-11:00 규칙은 30분 슬롯 4개를 만든다")
        void generate_MondayRule_FourHalfHourSlots() {
            // given
            var snapshot = snapshot(configuration(30, 2, "UTC", 0), rule(DayOfWeek.MONDAY, "09:00", "11:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T09:00:00Z"),
                    Instant.parse("2025-03-03T09:30:00Z"),
                    Instant.parse("2025-03-03T10:00:00Z"),
                    Instant.parse("2025-03-03T10:30:00Z"));
            assertThat(slots).allSatisfy(slot -> {
                assertThat(Duration.between(slot.startAt(), slot.endAt())).isEqualTo(Duration.ofMinutes(30));
                assertThat(slot.capacity()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("슬롯 길이로 나누어 떨어지지 않는 나머지는 버린다")
        void generate_Remainder_Dropped() {
            // given
            var snapshot = snapshot(configuration(30, 1, "UTC", 0), rule(DayOfWeek.MONDAY, "09:00", "10:45"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).hasSize(3);
            assertThat(slots.get(2).endAt()).isEqualTo(Instant.parse("2025-03-03T10:30:00Z"));
        }

        @Test
        @DisplayName("규칙이 없는 요일에는 슬롯이 없다")
        void generate_NoRuleForWeekday_Empty() {
            // given
            var snapshot = snapshot(configuration(60, 1, "UTC", 0), rule(DayOfWeek.TUESDAY, "09:00", "12:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).isEmpty();
        }

        @Test
        @DisplayName("비활성 규칙은 슬롯을 만들지 않는다")
        void generate_InactiveRule_Ignored() {
            // given
            var inactive = new AvailabilityRule(1L, DayOfWeek.MONDAY, LocalTime.of(9, 0), LocalTime.of(12, 0),
                    false, true, Instant.EPOCH, Instant.EPOCH);
            var snapshot = snapshot(configuration(60, 1, "UTC", 0), inactive);

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).isEmpty();
        }

        @Test
        @DisplayName("여러 날짜에 걸친 결과는 시작 시각 오름차순이다")
        void generate_MultipleDays_Ascending() {
            // given
            var snapshot = snapshot(configuration(60, 1, "UTC", 0),
                    rule(DayOfWeek.WEDNESDAY, "14:00", "16:00"),
                    rule(DayOfWeek.MONDAY, "09:00", "10:00"),
                    rule(DayOfWeek.MONDAY, "07:00", "08:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY.plusDays(6), BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).isSorted().containsExactly(
                    Instant.parse("2025-03-03T07:00:00Z"),
                    Instant.parse("2025-03-03T09:00:00Z"),
                    Instant.parse("2025-03-05T14:00:00Z"),
                    Instant.parse("2025-03-05T15:00:00Z"));
        }

        @Test
        @DisplayName("설정 타임존의 현지 시각을 UTC로 변환한다")
        void generate_ConfiguredZone_ConvertedToUtc() {
            // given
            var snapshot = snapshot(configuration(60, 1, "Asia/Seoul", 0), rule(DayOfWeek.MONDAY, "09:00", "10:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).singleElement().satisfies(slot -> {
                assertThat(slot.startAt()).isEqualTo(Instant.parse("2025-03-03T00:00:00Z"));
                assertThat(slot.endAt()).isEqualTo(Instant.parse("2025-03-03T01:00:00Z"));
            });
        }
    }

    @Nested
    @DisplayName("겹치는 규칙")
    class Overlap {

        @Test
        @DisplayName("겹치는 활성 규칙만 하나의 구간으로 합치고 맞닿은 규칙은 따로 분할한다")
        void generate_OverlappingRulesMerged_TouchingRuleSeparate() {
            // given
            var snapshot = snapshot(configuration(60, 1, "UTC", 0),
                    rule(DayOfWeek.MONDAY, "09:00", "10:00"),
                    rule(DayOfWeek.MONDAY, "09:30", "11:00"),
                    rule(DayOfWeek.MONDAY, "11:00", "12:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T09:00:00Z"),
                    Instant.parse("2025-03-03T10:00:00Z"),
                    Instant.parse("2025-03-03T11:00:00Z"));
        }

        @Test
        @DisplayName("맞닿은 규칙은 합치지 않으므로 각 규칙의 시작 시각부터 분할한다")
        void generate_TouchingRules_TiledFromEachStart() {
            // given
            var snapshot = snapshot(configuration(30, 1, "UTC", 0),
                    rule(DayOfWeek.MONDAY, "09:00", "10:15"),
                    rule(DayOfWeek.MONDAY, "10:15", "11:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T09:00:00Z"),
                    Instant.parse("2025-03-03T09:30:00Z"),
                    Instant.parse("2025-03-03T10:15:00Z"));
        }

        @Test
        @DisplayName("병합된 구간의 슬롯은 서로 겹치지 않는다")
        void generate_MergedRules_NoDuplicateSlots() {
            // given
            var snapshot = snapshot(configuration(30, 1, "UTC", 0),
                    rule(DayOfWeek.MONDAY, "09:00", "11:00"),
                    rule(DayOfWeek.MONDAY, "09:00", "11:00"));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).hasSize(4).doesNotHaveDuplicates();
            for (int i = 1; i < slots.size(); i++) {
                assertThat(slots.get(i).startAt()).isAfterOrEqualTo(slots.get(i - 1).endAt());
            }
        }
    }

    @Nested
    @DisplayName("추가 가용 블록")
    class Blocks {

        private AvailabilityBlock block(LocalDate date, String start, String end) {
            return new AvailabilityBlock(1L, date, LocalTime.parse(start), LocalTime.parse(end), Instant.EPOCH);
        }

        @Test
        @DisplayName("규칙이 없는 날에도 블록 구간만큼 슬롯을 만들고 해당 날짜에만 적용된다")
        void generate_BlockWithoutRule_AddsSlotsOnItsDate() {
            // given
            var snapshot = new AvailabilitySnapshot(configuration(60, 1, "UTC", 0),
                    List.of(), Set.of(), List.of(block(MONDAY, "14:00", "16:00")));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY.plusDays(7), BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T14:00:00Z"),
                    Instant.parse("2025-03-03T15:00:00Z"));
        }

        @Test
        @DisplayName("규칙과 겹치는 블록은 규칙 구간과 합쳐진다")
        void generate_BlockOverlappingRule_Merged() {
            // given
            var snapshot = new AvailabilitySnapshot(configuration(60, 1, "UTC", 0),
                    List.of(rule(DayOfWeek.MONDAY, "09:00", "11:00")),
                    Set.of(),
                    List.of(block(MONDAY, "10:30", "12:30")));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T09:00:00Z"),
                    Instant.parse("2025-03-03T10:00:00Z"),
                    Instant.parse("2025-03-03T11:00:00Z"));
        }

        @Test
        @DisplayName("예외 날짜에는 블록도 슬롯을 만들지 않는다")
        void generate_BlockOnExceptionDate_Suppressed() {
            // given
            var snapshot = new AvailabilitySnapshot(configuration(60, 1, "UTC", 0),
                    List.of(), Set.of(MONDAY), List.of(block(MONDAY, "14:00", "16:00")));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).isEmpty();
        }

        @Test
        @DisplayName("블록 구간의 슬롯은 정확한 슬롯 조회로 찾을 수 있다")
        void find_BlockSlot_Found() {
            // given
            var snapshot = new AvailabilitySnapshot(configuration(60, 1, "UTC", 0),
                    List.of(), Set.of(), List.of(block(MONDAY, "14:00", "16:00")));
            var key = new SlotKey(Instant.parse("2025-03-03T15:00:00Z"), Instant.parse("2025-03-03T16:00:00Z"));

            // when
            Optional<TimeSlot> found = slotGenerator.find(snapshot, key);

            // then
            assertThat(found).isPresent();
        }
    }

    @Nested
    @DisplayName("예외 날짜와 리드타임")
    class Filters {

        @Test
        @DisplayName("예외 날짜에는 슬롯이 없고 다른 날짜는 영향받지 않는다")
        void generate_ExceptionDate_Skipped() {
            // given
            var snapshot = new AvailabilitySnapshot(configuration(60, 1, "UTC", 0),
                    List.of(rule(DayOfWeek.MONDAY, "09:00", "10:00")),
                    Set.of(MONDAY));

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY.plusDays(7), BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(Instant.parse("2025-03-10T09:00:00Z"));
        }

        @Test
        @DisplayName("now + 최소 리드타임 이전에 시작하는 슬롯은 제외한다")
        void generate_WithinLeadTime_Filtered() {
            // given
            var snapshot = snapshot(configuration(30, 1, "UTC", 90), rule(DayOfWeek.MONDAY, "09:00", "11:00"));
            Instant now = Instant.parse("2025-03-03T08:00:00Z");

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, MONDAY, MONDAY, now).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-03-03T09:30:00Z"),
                    Instant.parse("2025-03-03T10:00:00Z"),
                    Instant.parse("2025-03-03T10:30:00Z"));
        }
    }

    @Nested
    @DisplayName("시퀀스 특성")
    class SequenceProperties {

        @Test
        @DisplayName("같은 입력으로 두 번 생성하면 같은 결과를 돌려준다")
        void generate_SameInput_SameResult() {
            // given
            var snapshot = snapshot(configuration(45, 3, "Europe/Paris", 60),
                    rule(DayOfWeek.MONDAY, "08:00", "12:00"),
                    rule(DayOfWeek.FRIDAY, "13:00", "18:30"));

            // when
            List<TimeSlot> first = slotGenerator.generate(snapshot, MONDAY, MONDAY.plusDays(13), BEFORE_WINDOW).toList();
            List<TimeSlot> second = slotGenerator.generate(snapshot, MONDAY, MONDAY.plusDays(13), BEFORE_WINDOW).toList();

            // then
            assertThat(first).isNotEmpty().isEqualTo(second);
        }

        @Test
        @DisplayName("시퀀스는 여러 번 순회해도 처음부터 다시 계산된다")
        void sequence_IteratedTwice_Restarts() {
            // given
            var snapshot = snapshot(configuration(60, 1, "UTC", 0), rule(DayOfWeek.MONDAY, "09:00", "12:00"));
            SlotSequence sequence = slotGenerator.generate(snapshot, MONDAY, MONDAY, BEFORE_WINDOW);

            // when
            List<TimeSlot> firstPass = new ArrayList<>();
            sequence.forEach(firstPass::add);
            List<TimeSlot> secondPass = new ArrayList<>();
            sequence.forEach(secondPass::add);

            // then
            assertThat(firstPass).hasSize(3).isEqualTo(secondPass);
            assertThat(sequence.stream().count()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("일광 절약 시간 전환")
    class DaylightSaving {

        private static final String NEW_YORK = "America/New_York";

        @Test
        @DisplayName("존재하지 않는 현지 시각에 걸친 슬롯은 만들지 않는다")
        void generate_SpringForwardGap_Skipped() {
            // given: 2025-03-09 02:00 -> 03:00
            var snapshot = snapshot(configuration(60, 1, NEW_YORK, 0), rule(DayOfWeek.SUNDAY, "01:00", "04:00"));
            LocalDate transition = LocalDate.of(2025, 3, 9);

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, transition, transition, BEFORE_WINDOW).toList();

            // then
            assertThat(slots).singleElement().satisfies(slot -> {
                assertThat(slot.startAt()).isEqualTo(Instant.parse("2025-03-09T07:00:00Z"));
                assertThat(slot.endAt()).isEqualTo(Instant.parse("2025-03-09T08:00:00Z"));
            });
        }

        @Test
        @DisplayName("중복되는 현지 시각은 이른 offset을 쓰고 길이가 달라지는 슬롯은 만들지 않는다")
        void generate_FallBackOverlap_EarlierOffset() {
            // given: 2025-11-02 02:00 EDT -> 01:00 EST
            var snapshot = snapshot(configuration(60, 1, NEW_YORK, 0), rule(DayOfWeek.SUNDAY, "00:00", "03:00"));
            LocalDate transition = LocalDate.of(2025, 11, 2);

            // when
            List<TimeSlot> slots = slotGenerator.generate(snapshot, transition, transition, BEFORE_WINDOW).toList();

            // then
            assertThat(starts(slots)).containsExactly(
                    Instant.parse("2025-11-02T04:00:00Z"),
                    Instant.parse("2025-11-02T07:00:00Z"));
            assertThat(slots).allSatisfy(slot ->
                    assertThat(Duration.between(slot.startAt(), slot.endAt())).isEqualTo(Duration.ofHours(1)));
        }
    }

    @Nested
    @DisplayName("정확한 슬롯 조회")
    class Find {

        private final AvailabilitySnapshot snapshot =
                snapshot(configuration(30, 1, "UTC", 1440), rule(DayOfWeek.MONDAY, "09:00", "11:00"));

        @Test
        @DisplayName("생성되는 슬롯과 정확히 일치하면 찾는다 (리드타임 무시)")
        void find_ExactBounds_Found() {
            // given
            var key = new SlotKey(Instant.parse("2025-03-03T09:30:00Z"), Instant.parse("2025-03-03T10:00:00Z"));

            // when
            Optional<TimeSlot> found = slotGenerator.find(snapshot, key);

            // then
            assertThat(found).hasValueSatisfying(slot -> assertThat(slot.key()).isEqualTo(key));
        }

        @Test
        @DisplayName("슬롯 경계와 어긋난 구간은 찾지 못한다")
        void find_MisalignedBounds_Empty() {
            // given
            var key = new SlotKey(Instant.parse("2025-03-03T09:15:00Z"), Instant.parse("2025-03-03T09:45:00Z"));

            // when
            Optional<TimeSlot> found = slotGenerator.find(snapshot, key);

            // then
            assertThat(found).isEmpty();
        }

        @Test
        @DisplayName("시작은 맞지만 길이가 다른 구간은 찾지 못한다")
        void find_WrongLength_Empty() {
            // given
            var key = new SlotKey(Instant.parse("2025-03-03T09:00:00Z"), Instant.parse("2025-03-03T10:00:00Z"));

            // when
            Optional<TimeSlot> found = slotGenerator.find(snapshot, key);

            // then
            assertThat(found).isEmpty();
        }
    }
}
