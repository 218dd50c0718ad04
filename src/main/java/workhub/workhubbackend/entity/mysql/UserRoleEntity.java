package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

import java.time.LocalDateTime;

/**
 * 사용자 역할 할당. 한 사용자가 여러 행을 가질 수 있다.
 * 역할별 권한 판단 포인터는 하나뿐이며 나머지 포인터는 화면 표시용 문맥이다.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "user_roles", indexes = {
        @Index(name = "idx_user_roles_user", columnList = "user_id"),
        @Index(name = "idx_user_roles_role", columnList = "role")
})
public class UserRoleEntity implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false)
    private AppRole role;

    @Column(name = "workspace_id", length = 36)
    private String workspaceId;

    @Column(name = "facility_id", length = 36)
    private String facilityId;

    @Column(name = "department_id", length = 36)
    private String departmentId;

    @Column(name = "created_by")
    private String createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public UserRoleEntity(String userId, AppRole role, String workspaceId, String facilityId, String departmentId) {
        this.userId = userId;
        this.role = role;
        this.workspaceId = workspaceId;
        this.facilityId = facilityId;
        this.departmentId = departmentId;
    }

    /**
     * 역할에 해당하는 권한 판단용 포인터 값. 관리 범위가 없는 역할은 null.
     */
    public String getAuthoritativeScopeId() {
        return scopePointer(role.getAuthoritativeScope());
    }

    public String scopePointer(ScopeType scopeType) {
        return switch (scopeType) {
            case WORKSPACE -> workspaceId;
            case FACILITY -> facilityId;
            case DEPARTMENT -> departmentId;
            default -> null;
        };
    }

    @Override
    public EntityKind trackedKind() {
        return EntityKind.ROLE_ASSIGNMENT;
    }

    @Override
    public String trackedSubjectId() {
        return userId;
    }
}
