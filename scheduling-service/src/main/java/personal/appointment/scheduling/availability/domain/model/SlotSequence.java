package personal.appointment.scheduling.availability.domain.model;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Slot Sequence
 * 시작 시각 오름차순의 지연 계산 슬롯 시퀀스
 * iterator()/stream()을 호출할 때마다 같은 입력으로 처음부터 다시 계산한다.
 */
public final class SlotSequence implements Iterable<TimeSlot> {

    private final Supplier<Stream<TimeSlot>> source;

    public SlotSequence(Supplier<Stream<TimeSlot>> source) {
        this.source = source;
    }

    public Stream<TimeSlot> stream() {
        return source.get();
    }

    @Override
    public Iterator<TimeSlot> iterator() {
        return stream().iterator();
    }

    public List<TimeSlot> toList() {
        return stream().toList();
    }
}
