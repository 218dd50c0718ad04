package workhub.workhubbackend.dto.approval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * 기간이 겹치는 요청과 최소 근무 인원 미달 일자
 */
@Getter
@Builder
@AllArgsConstructor
public class ConflictReport {
    private final Long requestId;
    private final long staffCount;
    private final int minimumCoverage;
    private final List<OverlapDto> overlaps;
    private final List<LocalDate> shortStaffedDays;

    public boolean isConflict() {
        return !shortStaffedDays.isEmpty();
    }
}
