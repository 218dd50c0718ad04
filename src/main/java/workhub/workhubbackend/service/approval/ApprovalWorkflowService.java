package workhub.workhubbackend.service.approval;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import workhub.workhubbackend.dto.approval.ApprovalActionResult;
import workhub.workhubbackend.dto.approval.ApprovalRequestViewDto;
import workhub.workhubbackend.dto.request.CreateApprovalRequestDto;
import workhub.workhubbackend.dto.response.NotificationResult;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.enums.approval.ApprovalDecision;
import workhub.workhubbackend.enums.approval.ApprovalStatus;

import java.util.List;

/**
 * 결재 요청 진입점. 상태 전이는 {@link ApprovalTransitionService} 의 트랜잭션에서 커밋되고,
 * 알림은 커밋이 끝난 뒤 이 클래스에서 보낸다. 이 클래스에는 트랜잭션을 걸지 않는다.
 */
@Service
@RequiredArgsConstructor
public class ApprovalWorkflowService {

    private final ApprovalTransitionService approvalTransitionService;
    private final ApprovalNotifier approvalNotifier;

    public ApprovalRequestViewDto createDraft(String requesterId, CreateApprovalRequestDto dto) {
        return approvalTransitionService.createDraft(requesterId, dto);
    }

    public ApprovalActionResult submit(Long requestId, String requesterId) {
        ApprovalRequest committed = approvalTransitionService.submit(requestId, requesterId);
        return new ApprovalActionResult(ApprovalRequestViewDto.from(committed), notifyCurrentLevel(committed));
    }

    public ApprovalActionResult route(Long requestId, String requesterId) {
        ApprovalRequest committed = approvalTransitionService.route(requestId, requesterId);
        return new ApprovalActionResult(ApprovalRequestViewDto.from(committed), notifyCurrentLevel(committed));
    }

    public ApprovalActionResult decide(Long requestId, int level, ApprovalDecision decision, String approverId,
                                       String comment, String conflictReason) {
        ApprovalRequest committed = approvalTransitionService.decide(requestId, level, decision, approverId,
                comment, conflictReason);

        List<NotificationResult> notifications;
        if (committed.getStatus() == ApprovalStatus.REJECTED) {
            notifications = committed.findStep(level)
                    .map(step -> approvalNotifier.notifyRejected(committed, step))
                    .orElse(List.of());
        } else if (committed.getStatus() == ApprovalStatus.FULLY_APPROVED) {
            notifications = approvalNotifier.notifyApproved(committed);
        } else {
            notifications = notifyCurrentLevel(committed);
        }
        return new ApprovalActionResult(ApprovalRequestViewDto.from(committed), notifications);
    }

    public ApprovalRequestViewDto cancel(Long requestId, String requesterId) {
        return approvalTransitionService.cancel(requestId, requesterId);
    }

    // level_k_pending 이면 k단계 결재자에게 알림
    private List<NotificationResult> notifyCurrentLevel(ApprovalRequest request) {
        if (request.getStatus() != ApprovalStatus.IN_REVIEW || request.getCurrentLevel() == null) {
            return List.of();
        }
        return request.findStep(request.getCurrentLevel())
                .map(step -> approvalNotifier.notifyApprovers(request, step))
                .orElse(List.of());
    }
}
