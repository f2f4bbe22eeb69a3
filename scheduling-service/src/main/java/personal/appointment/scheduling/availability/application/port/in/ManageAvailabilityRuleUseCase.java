package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Manage Availability Rule UseCase (Input Port)
 * 요일별 가용 시간 규칙 관리 유스케이스 (관리자 전용)
 * <p>
 * 같은 요일의 활성 규칙이 겹쳐도 등록을 거부하지 않는다. 슬롯 생성 시 합집합으로 병합된다.
 */
public interface ManageAvailabilityRuleUseCase {

    /**
     * 규칙 등록
     *
     * @throws personal.appointment.scheduling.availability.domain.exception.InvalidRuleException endTime <= startTime 일 때
     */
    AvailabilityRule addRule(AddAvailabilityRuleCommand command);

    /**
     * 규칙 부분 수정
     *
     * @throws personal.appointment.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException 규칙이 없을 때
     * @throws personal.appointment.scheduling.availability.domain.exception.InvalidRuleException 수정 결과가 유효하지 않을 때
     */
    AvailabilityRule updateRule(Long ruleId, UpdateAvailabilityRuleCommand command);

    /**
     * 규칙 삭제
     * 이미 확정된 예약은 시각을 복사해 두므로 영향을 받지 않는다.
     *
     * @throws personal.appointment.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException 규칙이 없을 때
     */
    void removeRule(Long ruleId);

    AvailabilityRule getRule(Long ruleId);

    /**
     * 요일별 규칙 목록 (시작 시각 오름차순)
     */
    List<AvailabilityRule> listRules(DayOfWeek weekday);

    /**
     * 전체 규칙 목록 (요일, 시작 시각 오름차순)
     */
    List<AvailabilityRule> listAllRules();
}
