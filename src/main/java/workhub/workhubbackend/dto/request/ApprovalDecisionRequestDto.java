package workhub.workhubbackend.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecisionRequestDto {
    @Min(1)
    private int level;
    @NotBlank
    @Pattern(regexp = "(?i)\\s*(approved?|reject(ed)?)\\s*", message = "approve(d) 또는 reject(ed) 만 허용됩니다.")
    private String decision;
    private String comment;
    private String conflictReason; // 충돌을 인지하고 결정할 때의 사유
}
