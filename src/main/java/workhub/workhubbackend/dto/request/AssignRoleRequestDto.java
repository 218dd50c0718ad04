package workhub.workhubbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignRoleRequestDto {
    @NotBlank
    private String userId;
    @NotBlank
    private String role; // super_admin, department_head ...
    private String workspaceId;
    private String facilityId;
    private String departmentId;
}
