package workhub.workhubbackend.dto.approval;

import lombok.AllArgsConstructor;
import lombok.Getter;
import workhub.workhubbackend.dto.response.NotificationResult;

import java.util.List;

/**
 * 상태 전이 결과. 알림 실패는 예외가 아니라 결과에 포함된다.
 */
@Getter
@AllArgsConstructor
public class ApprovalActionResult {
    private final ApprovalRequestViewDto request;
    private final List<NotificationResult> notifications;

    public List<NotificationResult> getDispatchErrors() {
        return notifications.stream()
                .filter(result -> !result.isSuccess())
                .toList();
    }
}
