package workhub.workhubbackend.service.approval;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.config.CacheConfig;
import workhub.workhubbackend.dto.approval.ApprovalRequestViewDto;
import workhub.workhubbackend.dto.approval.ConflictReport;
import workhub.workhubbackend.dto.response.ResolvedScope;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.entity.mysql.approval.ApprovalStep;
import workhub.workhubbackend.enums.approval.ApprovalStatus;
import workhub.workhubbackend.repository.mysql.approval.ApprovalRequestRepository;
import workhub.workhubbackend.service.ScopeResolver;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ApprovalQueryService {

    private final ApprovalRequestRepository approvalRequestRepository;
    private final ScopeResolver scopeResolver;
    private final ConflictDetector conflictDetector;

    /**
     * 요청 상태 조회. 변경 시 InvalidationBridge 가 캐시를 비운다.
     */
    @Cacheable(value = CacheConfig.APPROVAL_VIEW_CACHE, key = "#requestId")
    public ApprovalRequestViewDto getRequestView(Long requestId) {
        log.debug("결재 요청 DB 조회: {}", requestId);
        return ApprovalRequestViewDto.from(findRequest(requestId));
    }

    public List<ApprovalRequestViewDto> getMyRequests(String requesterId) {
        return approvalRequestRepository.findByRequesterIdOrderByCreatedAtDesc(requesterId).stream()
                .map(ApprovalRequestViewDto::from)
                .toList();
    }

    /**
     * 내가 결정해야 하는 요청 (현재 단계 역할로 요청 범위를 관리하는 경우)
     */
    public List<ApprovalRequestViewDto> pendingForApprover(String approverId) {
        List<ResolvedScope> managed = scopeResolver.managedScopes(approverId);
        if (managed.isEmpty()) {
            return List.of();
        }
        return approvalRequestRepository.findByStatusOrderBySubmittedAt(ApprovalStatus.IN_REVIEW).stream()
                .filter(request -> isAwaiting(request, managed))
                .map(ApprovalRequestViewDto::from)
                .toList();
    }

    public ConflictReport evaluateConflicts(Long requestId) {
        return conflictDetector.evaluate(findRequest(requestId));
    }

    private boolean isAwaiting(ApprovalRequest request, List<ResolvedScope> managed) {
        Optional<ApprovalStep> current = request.getCurrentLevel() != null
                ? request.findStep(request.getCurrentLevel())
                : Optional.empty();
        if (current.isEmpty()) {
            return false;
        }
        return managed.stream()
                .filter(scope -> scope.getRole() == current.get().getApproverRole())
                .anyMatch(scope -> scopeResolver.covers(scope, request.getScopeType(), request.getScopeId()));
    }

    private ApprovalRequest findRequest(Long requestId) {
        return approvalRequestRepository.findById(requestId)
                .orElseThrow(() -> new EntityNotFoundException("결재 요청을 찾을 수 없습니다: " + requestId));
    }
}
