package workhub.workhubbackend.dto.approval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlapDto {
    private Long requestId;
    private String requesterId;
    private LocalDate startDate;
    private LocalDate endDate;
    private String status;

    public static OverlapDto from(ApprovalRequest request) {
        return OverlapDto.builder()
                .requestId(request.getId())
                .requesterId(request.getRequesterId())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .status(request.getStatusLabel())
                .build();
    }
}
