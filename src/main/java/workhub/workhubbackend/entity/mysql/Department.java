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
@Table(name = "departments", indexes = {
        @Index(name = "idx_department_facility", columnList = "facility_id")
})
public class Department {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "facility_id", nullable = false, length = 36)
    private String facilityId; // 상위 시설

    @Column(name = "name", nullable = false)
    private String name;

    @Builder.Default
    @Column(name = "min_staffing")
    private Integer minStaffing = 1; // 최소 근무 인원

    @CreationTimestamp
    private LocalDateTime createdAt;
}
