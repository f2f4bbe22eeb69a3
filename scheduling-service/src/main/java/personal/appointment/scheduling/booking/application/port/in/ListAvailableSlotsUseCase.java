package personal.appointment.scheduling.booking.application.port.in;

import personal.appointment.scheduling.booking.domain.model.SlotAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * List Available Slots UseCase (Input Port)
 * 기간 내 슬롯과 남은 용량 조회 유스케이스
 */
public interface ListAvailableSlotsUseCase {

    /**
     * 예약 가능한 슬롯 목록 (남은 용량이 0인 슬롯 제외, 시작 시각 오름차순)
     *
     * @param from 시작 날짜 (설정 타임존 기준, 포함)
     * @param to   종료 날짜 (포함)
     * @throws personal.appointment.scheduling.availability.domain.exception.InvalidWindowException 기간이 올바르지 않을 때
     */
    List<SlotAvailability> listAvailableSlots(LocalDate from, LocalDate to);

    /**
     * 관리자용 전체 슬롯 목록 (마감된 슬롯은 남은 용량 0으로 포함)
     */
    List<SlotAvailability> listAllSlots(LocalDate from, LocalDate to);
}
