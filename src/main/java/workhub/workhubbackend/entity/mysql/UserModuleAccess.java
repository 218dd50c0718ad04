package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

/**
 * 사용자 개별 모듈 권한. isOverride=true 이면 역할 권한보다 우선한다.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "user_module_access",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "module_id"}))
public class UserModuleAccess implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "module_id", nullable = false, length = 36)
    private String moduleId;

    @Column(name = "can_view")
    private boolean canView;

    @Column(name = "can_edit")
    private boolean canEdit;

    @Column(name = "can_delete")
    private boolean canDelete;

    @Column(name = "can_admin")
    private boolean canAdmin;

    @Column(name = "is_override")
    private boolean override = true;

    public UserModuleAccess(String userId, String moduleId,
                            boolean canView, boolean canEdit, boolean canDelete, boolean canAdmin) {
        this.userId = userId;
        this.moduleId = moduleId;
        this.canView = canView;
        this.canEdit = canEdit;
        this.canDelete = canDelete;
        this.canAdmin = canAdmin;
    }

    @Override
    public EntityKind trackedKind() {
        return EntityKind.MODULE_GRANT;
    }

    @Override
    public String trackedSubjectId() {
        return userId;
    }
}
