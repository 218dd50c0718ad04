package workhub.workhubbackend.entity.mysql.approval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.approval.ApprovalDecision;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

import java.time.LocalDateTime;

@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "approval_steps",
        uniqueConstraints = @UniqueConstraint(name = "uk_approval_step_level", columnNames = {"request_id", "level"}))
@Getter
@Setter
@NoArgsConstructor
public class ApprovalStep implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "request_id", nullable = false)
    @JsonIgnore
    private ApprovalRequest request;

    @Column(name = "level", nullable = false)
    private int level; // 1..N

    @Enumerated(EnumType.STRING)
    @Column(name = "approver_role", nullable = false)
    private AppRole approverRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false)
    private ApprovalDecision decision = ApprovalDecision.PENDING;

    @Column(name = "decided_by")
    private String decidedBy;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    // 충돌을 인지한 상태로 결정했는지 여부
    @Column(name = "has_conflict", nullable = false)
    private boolean hasConflict = false;

    @Column(name = "conflict_reason", columnDefinition = "TEXT")
    private String conflictReason;

    public ApprovalStep(int level, AppRole approverRole) {
        this.level = level;
        this.approverRole = approverRole;
    }

    public boolean isDecided() {
        return decision != ApprovalDecision.PENDING;
    }

    @Override
    public EntityKind trackedKind() {
        return EntityKind.APPROVAL_STEP;
    }

    @Override
    public String trackedSubjectId() {
        return request != null && request.getId() != null ? String.valueOf(request.getId()) : null;
    }
}
