package workhub.workhubbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateApprovalRequestDto {
    private String title;
    @NotBlank
    private String scopeType; // workspace | facility | department
    @NotBlank
    private String scopeId;
    @NotNull
    private LocalDate startDate;
    @NotNull
    private LocalDate endDate; // 미포함
}
