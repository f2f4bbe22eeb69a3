package personal.appointment.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.ConfigurationResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.UpdateConfigurationRequest;
import personal.appointment.scheduling.availability.application.port.in.GetConfigurationUseCase;
import personal.appointment.scheduling.availability.application.port.in.UpdateConfigurationUseCase;
import personal.appointment.scheduling.availability.domain.model.SchedulingConfiguration;

/**
 * Admin Configuration API Controller
 * 전역 예약 설정 조회/수정 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/configuration")
@RequiredArgsConstructor
public class AdminConfigurationController {

    private final GetConfigurationUseCase getConfigurationUseCase;
    private final UpdateConfigurationUseCase updateConfigurationUseCase;

    /**
     * 현재 설정 조회
     * GET /api/v1/admin/configuration
     */
    @GetMapping
    public ResponseEntity<ApiResponse<ConfigurationResponse>> getConfiguration() {
        SchedulingConfiguration configuration = getConfigurationUseCase.getConfiguration();
        return ResponseEntity.ok(ApiResponse.success("설정 조회 성공", ConfigurationResponse.from(configuration)));
    }

    /**
     * 설정 부분 수정
     * PATCH /api/v1/admin/configuration
     */
    @PatchMapping
    public ResponseEntity<ApiResponse<ConfigurationResponse>> updateConfiguration(
            @Valid @RequestBody UpdateConfigurationRequest request
    ) {
        log.info("Update configuration: request={}", request);

        SchedulingConfiguration updated = updateConfigurationUseCase.updateConfiguration(request.toCommand());

        return ResponseEntity.ok(ApiResponse.success("설정 수정 성공", ConfigurationResponse.from(updated)));
    }
}
