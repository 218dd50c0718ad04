package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import workhub.workhubbackend.realtime.EntityKind;
import workhub.workhubbackend.realtime.RecordChangeEntityListener;
import workhub.workhubbackend.realtime.TrackedRecord;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@EntityListeners(RecordChangeEntityListener.class)
@Table(name = "module_definitions")
public class ModuleDefinition implements TrackedRecord {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "module_key", nullable = false, unique = true)
    private String moduleKey; // task_management, vacation_planning ...

    @Column(name = "name", nullable = false)
    private String name;

    private String description;

    @Column(name = "is_active")
    private Boolean isActive = true;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public ModuleDefinition(String id, String moduleKey, String name) {
        this.id = id;
        this.moduleKey = moduleKey;
        this.name = name;
    }

    @Override
    public EntityKind trackedKind() {
        return EntityKind.MODULE_GRANT;
    }

    @Override
    public String trackedSubjectId() {
        return null; // 모든 사용자에게 영향
    }
}
