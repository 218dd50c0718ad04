package workhub.workhubbackend.dto.approval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 결재 요청 조회용 스냅샷 (approvalViewCache 저장 대상)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequestViewDto {
    private Long id;
    private String requesterId;
    private String requestType;
    private String title;
    private String scopeType;
    private String scopeId;
    private LocalDate startDate;
    private LocalDate endDate;
    private String status; // draft, submitted, level_k_pending, fully_approved ...
    private Integer currentLevel;
    private Integer maxLevel;
    private boolean hasConflict;
    private List<ApprovalStepDto> steps;
    private LocalDateTime submittedAt;
    private LocalDateTime completedAt;

    public static ApprovalRequestViewDto from(ApprovalRequest request) {
        return ApprovalRequestViewDto.builder()
                .id(request.getId())
                .requesterId(request.getRequesterId())
                .requestType(request.getRequestType())
                .title(request.getTitle())
                .scopeType(request.getScopeType().getValue())
                .scopeId(request.getScopeId())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .status(request.getStatusLabel())
                .currentLevel(request.getCurrentLevel())
                .maxLevel(request.getMaxLevel())
                .hasConflict(request.isHasConflict())
                .steps(request.getSteps().stream().map(ApprovalStepDto::from).toList())
                .submittedAt(request.getSubmittedAt())
                .completedAt(request.getCompletedAt())
                .build();
    }
}
