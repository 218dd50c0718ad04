package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

/**
 * 역할 단위 모듈 권한
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "role_module_access",
        uniqueConstraints = @UniqueConstraint(columnNames = {"role", "module_id"}))
public class RoleModuleAccess implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false)
    private AppRole role;

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

    public RoleModuleAccess(AppRole role, String moduleId,
                            boolean canView, boolean canEdit, boolean canDelete, boolean canAdmin) {
        this.role = role;
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
        return null;
    }
}
