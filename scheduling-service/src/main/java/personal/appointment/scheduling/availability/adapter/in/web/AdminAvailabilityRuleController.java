package personal.appointment.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.appointment.common.dto.ApiResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.AddAvailabilityRuleRequest;
import personal.appointment.scheduling.availability.adapter.in.web.dto.AvailabilityRuleResponse;
import personal.appointment.scheduling.availability.adapter.in.web.dto.UpdateAvailabilityRuleRequest;
import personal.appointment.scheduling.availability.application.port.in.ManageAvailabilityRuleUseCase;
import personal.appointment.scheduling.availability.domain.model.AvailabilityRule;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Admin Availability Rule API Controller
 * 요일별 가용 시간 규칙 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/availability-rules")
@RequiredArgsConstructor
public class AdminAvailabilityRuleController {

    private final ManageAvailabilityRuleUseCase manageAvailabilityRuleUseCase;

    /**
     * 규칙 목록 조회 (weekday 지정 시 해당 요일만)
     * GET /api/v1/admin/availability-rules?weekday=MONDAY
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<AvailabilityRuleResponse>>> listRules(
            @RequestParam(required = false) DayOfWeek weekday
    ) {
        List<AvailabilityRule> rules = weekday == null
                ? manageAvailabilityRuleUseCase.listAllRules()
                : manageAvailabilityRuleUseCase.listRules(weekday);

        List<AvailabilityRuleResponse> response = rules.stream()
                .map(AvailabilityRuleResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("규칙 목록 조회 성공", response));
    }

    /**
     * GET /api/v1/admin/availability-rules/{ruleId}
     */
    @GetMapping("/{ruleId}")
    public ResponseEntity<ApiResponse<AvailabilityRuleResponse>> getRule(@PathVariable Long ruleId) {
        AvailabilityRule rule = manageAvailabilityRuleUseCase.getRule(ruleId);
        return ResponseEntity.ok(ApiResponse.success("규칙 조회 성공", AvailabilityRuleResponse.from(rule)));
    }

    /**
     * 규칙 등록
     * POST /api/v1/admin/availability-rules
     */
    @PostMapping
    public ResponseEntity<ApiResponse<AvailabilityRuleResponse>> addRule(
            @Valid @RequestBody AddAvailabilityRuleRequest request
    ) {
        log.info("Add availability rule: weekday={}, start={}, end={}",
                request.weekday(), request.startTime(), request.endTime());

        AvailabilityRule rule = manageAvailabilityRuleUseCase.addRule(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("규칙 등록 성공", AvailabilityRuleResponse.from(rule)));
    }

    /**
     * 규칙 부분 수정
     * PATCH /api/v1/admin/availability-rules/{ruleId}
     */
    @PatchMapping("/{ruleId}")
    public ResponseEntity<ApiResponse<AvailabilityRuleResponse>> updateRule(
            @PathVariable Long ruleId,
            @RequestBody UpdateAvailabilityRuleRequest request
    ) {
        log.info("Update availability rule: ruleId={}", ruleId);

        AvailabilityRule rule = manageAvailabilityRuleUseCase.updateRule(ruleId, request.toCommand());

        return ResponseEntity.ok(ApiResponse.success("규칙 수정 성공", AvailabilityRuleResponse.from(rule)));
    }

    /**
     * DELETE /api/v1/admin/availability-rules/{ruleId}
     */
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<ApiResponse<Void>> removeRule(@PathVariable Long ruleId) {
        log.info("Remove availability rule: ruleId={}", ruleId);

        manageAvailabilityRuleUseCase.removeRule(ruleId);

        return ResponseEntity.ok(ApiResponse.success("규칙 삭제 성공"));
    }
}
