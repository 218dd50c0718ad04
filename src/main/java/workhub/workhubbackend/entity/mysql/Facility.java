package workhub.workhubbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "facilities", indexes = {
        @Index(name = "idx_facility_workspace", columnList = "workspace_id")
})
public class Facility {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "workspace_id", nullable = false, length = 36)
    private String workspaceId; // 상위 워크스페이스

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "min_staffing")
    private Integer minStaffing;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
