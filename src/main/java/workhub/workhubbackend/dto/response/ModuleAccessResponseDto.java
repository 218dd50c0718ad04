package workhub.workhubbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleAccessResponseDto {
    private String moduleKey;
    private boolean canView;
    private boolean canEdit;
    private boolean canDelete;
    private boolean canAdmin;
}
