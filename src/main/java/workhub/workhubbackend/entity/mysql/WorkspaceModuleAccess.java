package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

/**
 * 워크스페이스별 모듈 사용 여부. 행이 없으면 사용 가능으로 본다.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "workspace_module_access",
        uniqueConstraints = @UniqueConstraint(columnNames = {"workspace_id", "module_id"}))
public class WorkspaceModuleAccess implements TrackedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workspace_id", nullable = false, length = 36)
    private String workspaceId;

    @Column(name = "module_id", nullable = false, length = 36)
    private String moduleId;

    @Column(name = "is_enabled")
    private boolean enabled = true;

    public WorkspaceModuleAccess(String workspaceId, String moduleId, boolean enabled) {
        this.workspaceId = workspaceId;
        this.moduleId = moduleId;
        this.enabled = enabled;
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
