package personal.appointment.scheduling.availability.application.port.in;

import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

/**
 * Get Configuration UseCase (Input Port)
 * 전역 예약 설정 조회 유스케이스
 */
public interface GetConfigurationUseCase {

    /**
     * 현재 설정 조회
     * 설정이 아직 없으면 기본값으로 초기화한 뒤 반환한다.
     *
     * @return 현재 설정
     */
    SchedulingConfiguration getConfiguration();
}
