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
@Table(name = "workspaces")
public class Workspace {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "min_staffing")
    private Integer minStaffing; // 워크스페이스 단위 최소 근무 인원 (없으면 기본값 사용)

    @CreationTimestamp
    private LocalDateTime createdAt;
}
