package workhub.workhubbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleAssignmentResponseDto {
    private Long id;
    private String userId;
    private String role;
    private String workspaceId;
    private String facilityId;
    private String departmentId;

    public static RoleAssignmentResponseDto from(UserRoleEntity entity) {
        return RoleAssignmentResponseDto.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .role(entity.getRole().getValue())
                .workspaceId(entity.getWorkspaceId())
                .facilityId(entity.getFacilityId())
                .departmentId(entity.getDepartmentId())
                .build();
    }
}
