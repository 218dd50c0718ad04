package workhub.workhubbackend.service.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import workhub.workhubbackend.dto.request.NotificationRequest;
import workhub.workhubbackend.dto.response.NotificationResult;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.entity.mysql.approval.ApprovalStep;
import workhub.workhubbackend.service.NotificationService;
import workhub.workhubbackend.util.DateUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * 휴가 결재 알림 문구 구성 및 발송
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalNotifier {

    private static final String TYPE = "vacation";

    private final NotificationService notificationService;
    private final ApproverDirectory approverDirectory;

    /**
     * 해당 단계 결재자 전원에게 결재 요청 알림
     */
    public List<NotificationResult> notifyApprovers(ApprovalRequest request, ApprovalStep step) {
        List<String> approvers = approverDirectory.findEligibleApprovers(
                step.getApproverRole(), request.getScopeType(), request.getScopeId());
        if (approvers.isEmpty()) {
            log.warn("{}단계 결재자가 없어 알림을 보내지 못했습니다: requestId={}", step.getLevel(), request.getId());
        }
        String message = String.format("%s 님의 휴가 계획(%s)이 %d단계 결재를 기다리고 있습니다.",
                request.getRequesterId(), DateUtil.format(request.getStartDate(), request.getEndDate()), step.getLevel());

        List<NotificationResult> results = new ArrayList<>();
        for (String approverId : approvers) {
            results.add(send(approverId, "휴가 계획 결재 요청", message, request.getId()));
        }
        return results;
    }

    public List<NotificationResult> notifyApproved(ApprovalRequest request) {
        String message = String.format("휴가 계획(%s)이 최종 승인되었습니다.",
                DateUtil.format(request.getStartDate(), request.getEndDate()));
        return List.of(send(request.getRequesterId(), "휴가 계획 승인", message, request.getId()));
    }

    public List<NotificationResult> notifyRejected(ApprovalRequest request, ApprovalStep step) {
        String message = String.format("휴가 계획(%s)이 %d단계에서 반려되었습니다.",
                DateUtil.format(request.getStartDate(), request.getEndDate()), step.getLevel());
        if (step.getComment() != null && !step.getComment().isBlank()) {
            message += " 사유: " + step.getComment();
        }
        return List.of(send(request.getRequesterId(), "휴가 계획 반려", message, request.getId()));
    }

    private NotificationResult send(String userId, String title, String message, Long requestId) {
        return notificationService.dispatch(NotificationRequest.builder()
                .userId(userId)
                .title(title)
                .message(message)
                .type(TYPE)
                .relatedId(requestId)
                .build());
    }
}
