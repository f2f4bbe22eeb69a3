package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

/**
 * Update Configuration UseCase (Input Port)
 * 전역 예약 설정 수정 유스케이스 (관리자 전용)
 */
public interface UpdateConfigurationUseCase {

    /**
     * 설정 부분 수정
     *
     * @param command 변경할 필드 (null이면 기존 값 유지)
     * @return 수정된 설정
     * @throws personal.appointment.scheduling.availability.domain.exception.InvalidConfigurationException 값이 유효하지 않을 때 (아무것도 반영되지 않음)
     */
    SchedulingConfiguration updateConfiguration(UpdateConfigurationCommand command);
}
