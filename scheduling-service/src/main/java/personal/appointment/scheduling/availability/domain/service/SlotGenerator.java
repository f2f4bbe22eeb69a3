package personal.appointment.scheduling.availability.domain.service;

import com.google.common.collect.Range;
import org.springframework.stereotype.Component;
import personal.appointment.scheduling.availability.domain.model.AvailabilitySnapshot;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;
import personal.appointment.scheduling.availability.domain.model.SlotKey;
import personal.appointment.scheduling.availability.domain.model.SlotSequence;
import personal.appointment.scheduling.availability.domain.model.TimeSlot;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Slot Generator (Domain Service)
 * 규칙, 예외 날짜, 설정으로부터 예약 가능 슬롯을 계산하는 순수 함수
 * <p>
 * 날짜별 처리 순서:
 * <ol>
 *     <li>예외 날짜면 건너뛴다</li>
 *     <li>해당 요일의 활성 규칙과 그 날짜의 추가 가용 블록을 모은다</li>
 *     <li>실제로 겹치는 구간만 합집합으로 병합한다. 끝과 시작이 맞닿은 구간은 각자 따로 분할한다</li>
 *     <li>병합된 구간의 시작부터 슬롯 길이 단위로 자르고, 끝을 넘는 나머지는 버린다</li>
 *     <li>설정된 타임존으로 UTC 시각을 계산한다</li>
 * </ol>
 * DST: 해당 날짜의 타임존 규칙으로 해석한다. 시작/종료가 존재하지 않는 시각(gap)에 걸리는 슬롯과
 * 실제 길이가 슬롯 길이와 달라지는 슬롯은 생성하지 않는다. 중복 시각(overlap)은 이른 offset을 사용한다.
 */
@Component
public class SlotGenerator {

    /**
     * 기간 내 예약 가능 슬롯 생성
     * now + 최소 예약 리드타임 이전에 시작하는 슬롯은 제외한다.
     *
     * @param snapshot    설정, 규칙, 예외 날짜, 추가 가용 블록
     * @param windowStart 시작 날짜 (포함)
     * @param windowEnd   종료 날짜 (포함)
     * @param now         현재 시각
     * @return 시작 시각 오름차순 슬롯 시퀀스
     */
    public SlotSequence generate(AvailabilitySnapshot snapshot, LocalDate windowStart, LocalDate windowEnd, Instant now) {
        Instant earliestStart = now.plus(snapshot.configuration().minBookingLead());
        return new SlotSequence(() -> windowStart.datesUntil(windowEnd.plusDays(1))
                .flatMap(date -> slotsOn(snapshot, date))
                .filter(slot -> !slot.startAt().isBefore(earliestStart)));
    }

    /**
     * 요청 구간과 정확히 일치하는 슬롯 조회 (리드타임 필터 미적용)
     * 예약 시점 재검증에서 "없는 슬롯"과 "너무 임박한 슬롯"을 구분하기 위해 사용
     */
    public Optional<TimeSlot> find(AvailabilitySnapshot snapshot, SlotKey key) {
        ZoneId zone = snapshot.configuration().timezone();
        LocalDate date = LocalDateTime.ofInstant(key.startAt(), zone).toLocalDate();
        return slotsOn(snapshot, date)
                .filter(slot -> slot.key().equals(key))
                .findFirst();
    }

    private Stream<TimeSlot> slotsOn(AvailabilitySnapshot snapshot, LocalDate date) {
        if (snapshot.isExceptionDate(date)) {
            return Stream.empty();
        }
        SchedulingConfiguration configuration = snapshot.configuration();
        long slotSeconds = configuration.slotDuration().toSeconds();

        return mergeOverlapping(intervalsOn(snapshot, date)).stream()
                .flatMap(interval -> chunkStarts(interval, slotSeconds)
                        .mapToObj(start -> resolve(date, start, start + slotSeconds, configuration))
                        .flatMap(Optional::stream));
    }

    private List<Range<LocalTime>> intervalsOn(AvailabilitySnapshot snapshot, LocalDate date) {
        List<Range<LocalTime>> intervals = new ArrayList<>();
        snapshot.activeRulesOn(date.getDayOfWeek())
                .forEach(rule -> intervals.add(Range.closedOpen(rule.startTime(), rule.endTime())));
        snapshot.blocksOn(date)
                .forEach(block -> intervals.add(Range.closedOpen(block.startTime(), block.endTime())));
        return intervals;
    }

    /**
     * 시작 시각 순으로 정렬한 뒤 공통 구간이 있는 경우에만 합친다.
     * closedOpen 구간이 맞닿기만 하면 교집합이 빈 구간이므로 합치지 않는다.
     */
    private List<Range<LocalTime>> mergeOverlapping(List<Range<LocalTime>> intervals) {
        List<Range<LocalTime>> sorted = intervals.stream()
                .sorted(Comparator.comparing((Range<LocalTime> range) -> range.lowerEndpoint()))
                .toList();

        List<Range<LocalTime>> merged = new ArrayList<>();
        for (Range<LocalTime> interval : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && overlaps(merged.get(last), interval)) {
                merged.set(last, merged.get(last).span(interval));
            } else {
                merged.add(interval);
            }
        }
        return merged;
    }

    private boolean overlaps(Range<LocalTime> a, Range<LocalTime> b) {
        return a.isConnected(b) && !a.intersection(b).isEmpty();
    }

    // 초 단위로 계산해야 자정 근처에서 LocalTime이 순환하지 않는다
    private LongStream chunkStarts(Range<LocalTime> interval, long slotSeconds) {
        long start = interval.lowerEndpoint().toSecondOfDay();
        long end = interval.upperEndpoint().toSecondOfDay();
        return LongStream.iterate(start, chunkStart -> chunkStart + slotSeconds <= end, chunkStart -> chunkStart + slotSeconds);
    }

    private Optional<TimeSlot> resolve(LocalDate date, long startSecond, long endSecond,
                                       SchedulingConfiguration configuration) {
        ZoneId zone = configuration.timezone();
        ZoneRules rules = zone.getRules();
        LocalDateTime localStart = date.atTime(LocalTime.ofSecondOfDay(startSecond));
        LocalDateTime localEnd = date.atTime(LocalTime.ofSecondOfDay(endSecond));

        if (rules.getValidOffsets(localStart).isEmpty() || rules.getValidOffsets(localEnd).isEmpty()) {
            return Optional.empty();
        }

        Instant startAt = ZonedDateTime.ofLocal(localStart, zone, null).toInstant();
        Instant endAt = ZonedDateTime.ofLocal(localEnd, zone, null).toInstant();
        if (!Duration.between(startAt, endAt).equals(configuration.slotDuration())) {
            return Optional.empty();
        }
        return Optional.of(new TimeSlot(startAt, endAt, configuration.maxAppointmentsPerSlot()));
    }
}
