package workhub.workhubbackend.entity.mysql.approval;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.enums.approval.ApprovalStatus;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 범위 기반 다단계 결재 요청 (휴가 계획 등).
 * 기간은 [startDate, endDate) 반개구간이다.
 */
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "approval_requests", indexes = {
        @Index(name = "idx_approval_scope_status", columnList = "scope_type, scope_id, status"),
        @Index(name = "idx_approval_requester", columnList = "requester_id")
})
@Getter
@Setter
@NoArgsConstructor
public class ApprovalRequest implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "requester_id", nullable = false)
    private String requesterId;

    @Column(name = "request_type", nullable = false)
    private String requestType = "vacation";

    @Column(name = "title")
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false)
    private ScopeType scopeType;

    @Column(name = "scope_id", nullable = false, length = 36)
    private String scopeId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate; // 미포함

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ApprovalStatus status = ApprovalStatus.DRAFT;

    @Column(name = "current_level")
    private Integer currentLevel; // IN_REVIEW 상태에서만 값이 있음

    @Column(name = "max_level")
    private Integer maxLevel; // 제출 시점 결재 단계 수 스냅샷

    @Column(name = "has_conflict", nullable = false)
    private boolean hasConflict = false;

    @OneToMany(mappedBy = "request", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("level ASC")
    private List<ApprovalStep> steps = new ArrayList<>();

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public void addStep(ApprovalStep step) {
        step.setRequest(this);
        steps.add(step);
    }

    public Optional<ApprovalStep> findStep(int level) {
        return steps.stream()
                .filter(step -> step.getLevel() == level)
                .findFirst();
    }

    /**
     * 외부로 노출하는 상태 이름 (draft, submitted, level_2_pending, fully_approved ...)
     */
    public String getStatusLabel() {
        if (status == ApprovalStatus.IN_REVIEW && currentLevel != null) {
            return "level_" + currentLevel + "_pending";
        }
        return status.name().toLowerCase();
    }

    @Override
    public EntityKind trackedKind() {
        return EntityKind.APPROVAL_REQUEST;
    }

    @Override
    public String trackedSubjectId() {
        return id != null ? String.valueOf(id) : null;
    }
}
