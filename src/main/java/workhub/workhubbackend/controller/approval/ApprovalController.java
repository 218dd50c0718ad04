package workhub.workhubbackend.controller.approval;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import workhub.workhubbackend.dto.approval.ApprovalActionResult;
import workhub.workhubbackend.dto.approval.ApprovalRequestViewDto;
import workhub.workhubbackend.dto.approval.ConflictReport;
import workhub.workhubbackend.dto.request.ApprovalDecisionRequestDto;
import workhub.workhubbackend.dto.request.CreateApprovalRequestDto;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.enums.approval.ApprovalDecision;
import workhub.workhubbackend.service.access.ModuleAccessGuard;
import workhub.workhubbackend.service.approval.ApprovalQueryService;
import workhub.workhubbackend.service.approval.ApprovalWorkflowService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalWorkflowService approvalWorkflowService;
    private final ApprovalQueryService approvalQueryService;
    private final ModuleAccessGuard moduleAccessGuard;

    @PostMapping
    public ResponseEntity<ApprovalRequestViewDto> create(@Valid @RequestBody CreateApprovalRequestDto request,
                                                         Authentication authentication) {
        String userId = requireVacation(authentication, Capability.EDIT);
        return ResponseEntity.ok(approvalWorkflowService.createDraft(userId, request));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ApprovalActionResult> submit(@PathVariable Long id, Authentication authentication) {
        String userId = requireVacation(authentication, Capability.EDIT);
        return ResponseEntity.ok(approvalWorkflowService.submit(id, userId));
    }

    @PostMapping("/{id}/route")
    public ResponseEntity<ApprovalActionResult> route(@PathVariable Long id, Authentication authentication) {
        String userId = requireVacation(authentication, Capability.EDIT);
        return ResponseEntity.ok(approvalWorkflowService.route(id, userId));
    }

    /**
     * 단계 결정 (approve(d) | reject(ed)). 범위 확인은 서비스에서 수행
     */
    @PostMapping("/{id}/decisions")
    public ResponseEntity<ApprovalActionResult> decide(@PathVariable Long id,
                                                       @Valid @RequestBody ApprovalDecisionRequestDto request,
                                                       Authentication authentication) {
        String userId = requireVacation(authentication, Capability.VIEW);
        ApprovalDecision decision = ApprovalDecision.fromValue(request.getDecision());
        return ResponseEntity.ok(approvalWorkflowService.decide(id, request.getLevel(), decision, userId,
                request.getComment(), request.getConflictReason()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApprovalRequestViewDto> cancel(@PathVariable Long id, Authentication authentication) {
        String userId = requireVacation(authentication, Capability.EDIT);
        return ResponseEntity.ok(approvalWorkflowService.cancel(id, userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApprovalRequestViewDto> get(@PathVariable Long id, Authentication authentication) {
        requireVacation(authentication, Capability.VIEW);
        return ResponseEntity.ok(approvalQueryService.getRequestView(id));
    }

    @GetMapping("/{id}/conflicts")
    public ResponseEntity<ConflictReport> conflicts(@PathVariable Long id, Authentication authentication) {
        requireVacation(authentication, Capability.VIEW);
        return ResponseEntity.ok(approvalQueryService.evaluateConflicts(id));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ApprovalRequestViewDto>> pending(Authentication authentication) {
        String userId = requireVacation(authentication, Capability.VIEW);
        return ResponseEntity.ok(approvalQueryService.pendingForApprover(userId));
    }

    @GetMapping("/mine")
    public ResponseEntity<List<ApprovalRequestViewDto>> mine(Authentication authentication) {
        String userId = requireVacation(authentication, Capability.VIEW);
        return ResponseEntity.ok(approvalQueryService.getMyRequests(userId));
    }

    private String requireVacation(Authentication authentication, Capability capability) {
        String userId = (String) authentication.getPrincipal();
        moduleAccessGuard.require(userId, ModuleKey.VACATION_PLANNING, capability);
        return userId;
    }
}
