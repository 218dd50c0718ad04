package workhub.workhubbackend.service.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.dto.approval.ConflictReport;
import workhub.workhubbackend.dto.approval.OverlapDto;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.enums.approval.ApprovalStatus;
import workhub.workhubbackend.repository.mysql.approval.ApprovalRequestRepository;
import workhub.workhubbackend.service.OrganizationService;
import workhub.workhubbackend.util.DateUtil;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 같은 범위의 겹치는 휴가로 최소 근무 인원이 깨지는지 확인한다. 결과는 표시용이며 요청을 막지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictDetector {

    // 부재로 계산하는 상태 (최종 승인 + 결재 진행 중)
    private static final Set<ApprovalStatus> ABSENCE_STATUSES = EnumSet.of(ApprovalStatus.FULLY_APPROVED, ApprovalStatus.IN_REVIEW);

    private final ApprovalRequestRepository approvalRequestRepository;
    private final OrganizationService organizationService;

    @Transactional(readOnly = true)
    public ConflictReport evaluate(ApprovalRequest request) {
        Long excludeId = request.getId() != null ? request.getId() : -1L;
        List<ApprovalRequest> overlapping = approvalRequestRepository.findOverlapping(
                request.getScopeType(), request.getScopeId(), ABSENCE_STATUSES, excludeId,
                request.getStartDate(), request.getEndDate());

        long staffCount = organizationService.staffCount(request.getScopeType(), request.getScopeId());
        int minimumCoverage = organizationService.minimumCoverage(request.getScopeType(), request.getScopeId());

        List<LocalDate> shortStaffedDays = new ArrayList<>();
        for (LocalDate day : DateUtil.daysOf(request.getStartDate(), request.getEndDate())) {
            Set<String> absent = new HashSet<>();
            absent.add(request.getRequesterId());
            for (ApprovalRequest other : overlapping) {
                if (DateUtil.contains(other.getStartDate(), other.getEndDate(), day)) {
                    absent.add(other.getRequesterId());
                }
            }
            if (staffCount - absent.size() < minimumCoverage) {
                shortStaffedDays.add(day);
            }
        }

        if (!shortStaffedDays.isEmpty()) {
            log.info("최소 근무 인원 미달: requestId={}, scope={}:{}, staff={}, min={}, days={}",
                    request.getId(), request.getScopeType().getValue(), request.getScopeId(),
                    staffCount, minimumCoverage, shortStaffedDays.size());
        }

        return ConflictReport.builder()
                .requestId(request.getId())
                .staffCount(staffCount)
                .minimumCoverage(minimumCoverage)
                .overlaps(overlapping.stream().map(OverlapDto::from).toList())
                .shortStaffedDays(shortStaffedDays)
                .build();
    }
}
