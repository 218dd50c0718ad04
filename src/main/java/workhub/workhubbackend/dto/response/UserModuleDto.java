package workhub.workhubbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * get_user_modules 결과 한 행
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserModuleDto {
    private String moduleId;
    private String moduleKey;
    private String moduleName;
    private boolean canView;
    private boolean canEdit;
    private boolean canDelete;
    private boolean canAdmin;
}
