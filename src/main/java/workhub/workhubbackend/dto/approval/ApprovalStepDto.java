package workhub.workhubbackend.dto.approval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import workhub.workhubbackend.entity.mysql.approval.ApprovalStep;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalStepDto {
    private int level;
    private String approverRole;
    private String decision;
    private String decidedBy;
    private LocalDateTime decidedAt;
    private String comment;
    private boolean hasConflict;
    private String conflictReason;

    public static ApprovalStepDto from(ApprovalStep step) {
        return ApprovalStepDto.builder()
                .level(step.getLevel())
                .approverRole(step.getApproverRole().getValue())
                .decision(step.getDecision().name().toLowerCase())
                .decidedBy(step.getDecidedBy())
                .decidedAt(step.getDecidedAt())
                .comment(step.getComment())
                .hasConflict(step.isHasConflict())
                .conflictReason(step.getConflictReason())
                .build();
    }
}
