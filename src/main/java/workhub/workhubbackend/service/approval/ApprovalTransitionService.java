package workhub.workhubbackend.service.approval;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.config.ApprovalProperties;
import workhub.workhubbackend.dto.approval.ApprovalRequestViewDto;
import workhub.workhubbackend.dto.approval.ConflictReport;
import workhub.workhubbackend.dto.request.CreateApprovalRequestDto;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.entity.mysql.approval.ApprovalStep;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.enums.approval.ApprovalDecision;
import workhub.workhubbackend.enums.approval.ApprovalStatus;
import workhub.workhubbackend.exception.DuplicateDecisionException;
import workhub.workhubbackend.exception.InvalidTransitionException;
import workhub.workhubbackend.exception.NoApproverConfiguredException;
import workhub.workhubbackend.exception.NotRequesterException;
import workhub.workhubbackend.exception.RequestAlreadyTerminalException;
import workhub.workhubbackend.exception.ScopeAccessDeniedException;
import workhub.workhubbackend.repository.mysql.approval.ApprovalRequestRepository;
import workhub.workhubbackend.service.OrganizationService;
import workhub.workhubbackend.service.ScopeResolver;
import workhub.workhubbackend.util.DateUtil;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 범위 기반 다단계 결재 상태 머신.
 * draft → submitted → level_1_pending → ... → fully_approved, 각 pending 단계에서 rejected 가능.
 * 모든 전이는 한 트랜잭션 안에서 전부 적용되거나 전혀 적용되지 않는다. 알림은 보내지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalTransitionService {

    private final ApprovalRequestRepository approvalRequestRepository;
    private final ApprovalProperties approvalProperties;
    private final ApproverDirectory approverDirectory;
    private final ScopeResolver scopeResolver;
    private final OrganizationService organizationService;
    private final ConflictDetector conflictDetector;
    private final Clock clock;

    @Transactional
    public ApprovalRequestViewDto createDraft(String requesterId, CreateApprovalRequestDto dto) {
        ScopeType scopeType = ScopeType.fromValue(dto.getScopeType());
        if (!scopeType.isOrgUnit()) {
            throw new IllegalArgumentException("결재 요청 범위는 workspace/facility/department 중 하나여야 합니다.");
        }
        DateUtil.requireValidRange(dto.getStartDate(), dto.getEndDate());
        organizationService.requireExists(scopeType, dto.getScopeId());

        ApprovalRequest request = new ApprovalRequest();
        request.setRequesterId(requesterId);
        request.setTitle(dto.getTitle());
        request.setScopeType(scopeType);
        request.setScopeId(dto.getScopeId());
        request.setStartDate(dto.getStartDate());
        request.setEndDate(dto.getEndDate());
        request.setStatus(ApprovalStatus.DRAFT);

        ApprovalRequest saved = approvalRequestRepository.save(request);
        log.info("결재 요청 작성: requestId={}, requesterId={}, scope={}:{}",
                saved.getId(), requesterId, scopeType.getValue(), dto.getScopeId());
        return ApprovalRequestViewDto.from(saved);
    }

    /**
     * draft → submitted. 1단계 결재자가 없으면 NoApproverConfiguredException.
     * auto-route 설정이면 바로 level_1_pending 으로 보낸다.
     */
    @Transactional
    public ApprovalRequest submit(Long requestId, String requesterId) {
        ApprovalRequest request = findRequest(requestId);
        requireRequester(request, requesterId);
        requireStatus(request, ApprovalStatus.DRAFT, "submit");

        List<AppRole> levels = approvalProperties.levelsFor(request.getScopeType());
        if (levels.isEmpty()) {
            throw new NoApproverConfiguredException(request.getScopeType(), request.getScopeId(), 1, null);
        }
        requireApprovers(request, 1, levels.get(0));

        // 제출 시점의 결재선을 고정
        request.getSteps().clear();
        for (int i = 0; i < levels.size(); i++) {
            request.addStep(new ApprovalStep(i + 1, levels.get(i)));
        }
        request.setMaxLevel(levels.size());
        request.setStatus(ApprovalStatus.SUBMITTED);
        request.setSubmittedAt(LocalDateTime.now(clock));
        log.info("결재 요청 제출: requestId={}, levels={}", requestId, levels.size());

        if (approvalProperties.isAutoRoute()) {
            routeToFirstLevel(request);
        }
        return persist(request, 0);
    }

    /**
     * submitted → level_1_pending (auto-route 를 끈 경우)
     */
    @Transactional
    public ApprovalRequest route(Long requestId, String requesterId) {
        ApprovalRequest request = findRequest(requestId);
        requireRequester(request, requesterId);
        requireStatus(request, ApprovalStatus.SUBMITTED, "route");

        ApprovalStep first = request.findStep(1)
                .orElseThrow(() -> new NoApproverConfiguredException(request.getScopeType(), request.getScopeId(), 1, null));
        requireApprovers(request, 1, first.getApproverRole());

        routeToFirstLevel(request);
        return persist(request, 0);
    }

    /**
     * level 단계 결정. 이미 결정된 단계 → DuplicateDecision, 종료된 요청 → RequestAlreadyTerminal,
     * 현재 단계가 아님 → InvalidTransition, 범위 밖 → ScopeAccessDenied.
     * 충돌은 표시만 하고 자동 반려하지 않는다.
     */
    @Transactional
    public ApprovalRequest decide(Long requestId, int level, ApprovalDecision decision, String approverId,
                                       String comment, String conflictReason) {
        if (decision == null || decision == ApprovalDecision.PENDING) {
            throw new IllegalArgumentException("결정은 approved 또는 rejected 여야 합니다.");
        }
        ApprovalRequest request = findRequest(requestId);

        ApprovalStep step = request.findStep(level).orElse(null);
        if (step != null && step.isDecided()) {
            throw new DuplicateDecisionException(requestId, level);
        }
        if (request.getStatus().isTerminal()) {
            throw new RequestAlreadyTerminalException(requestId, request.getStatus());
        }
        if (request.getStatus() != ApprovalStatus.IN_REVIEW || step == null
                || request.getCurrentLevel() == null || request.getCurrentLevel() != level) {
            throw new InvalidTransitionException(requestId, String.format(
                    "요청 %d 은(는) %s 상태이므로 %d단계를 결정할 수 없습니다", requestId, request.getStatusLabel(), level));
        }
        if (!scopeResolver.canActOn(approverId, step.getApproverRole(), request.getScopeType(), request.getScopeId())) {
            throw new ScopeAccessDeniedException(approverId, requestId, String.format("%d단계는 %s 역할로 %s %s 를 관리해야 합니다",
                    level, step.getApproverRole().getValue(), request.getScopeType().getValue(), request.getScopeId()));
        }

        ConflictReport report = conflictDetector.evaluate(request);
        request.setHasConflict(report.isConflict());

        step.setDecision(decision);
        step.setDecidedBy(approverId);
        step.setDecidedAt(LocalDateTime.now(clock));
        step.setComment(comment);
        step.setHasConflict(report.isConflict());
        if (conflictReason != null && !conflictReason.isBlank()) {
            step.setConflictReason(conflictReason);
        }

        if (decision == ApprovalDecision.REJECTED) {
            // 남은 단계는 pending 그대로 고정
            request.setStatus(ApprovalStatus.REJECTED);
            request.setCurrentLevel(null);
            request.setCompletedAt(LocalDateTime.now(clock));
            log.info("결재 반려: requestId={}, level={}, approverId={}", requestId, level, approverId);
        } else if (level >= request.getMaxLevel()) {
            request.setStatus(ApprovalStatus.FULLY_APPROVED);
            request.setCurrentLevel(null);
            request.setCompletedAt(LocalDateTime.now(clock));
            log.info("결재 최종 승인: requestId={}, approverId={}, hasConflict={}", requestId, approverId, report.isConflict());
        } else {
            request.setCurrentLevel(level + 1);
            log.info("결재 승인: requestId={}, level={}, approverId={}, 다음 단계={}", requestId, level, approverId, level + 1);
        }

        return persist(request, level);
    }

    /**
     * draft/submitted 상태에서 신청자만 취소 가능
     */
    @Transactional
    public ApprovalRequestViewDto cancel(Long requestId, String requesterId) {
        ApprovalRequest request = findRequest(requestId);
        requireRequester(request, requesterId);
        if (request.getStatus().isTerminal()) {
            throw new RequestAlreadyTerminalException(requestId, request.getStatus());
        }
        if (!request.getStatus().isCancellable()) {
            throw new InvalidTransitionException(requestId, String.format(
                    "요청 %d 은(는) %s 상태이므로 취소할 수 없습니다", requestId, request.getStatusLabel()));
        }
        request.setStatus(ApprovalStatus.CANCELLED);
        request.setCurrentLevel(null);
        request.setCompletedAt(LocalDateTime.now(clock));
        log.info("결재 요청 취소: requestId={}, requesterId={}", requestId, requesterId);
        return ApprovalRequestViewDto.from(persist(request, 0));
    }

    private void routeToFirstLevel(ApprovalRequest request) {
        ConflictReport report = conflictDetector.evaluate(request);
        request.setHasConflict(report.isConflict());
        request.setStatus(ApprovalStatus.IN_REVIEW);
        request.setCurrentLevel(1);
        log.info("결재 라우팅: requestId={}, level=1, hasConflict={}", request.getId(), report.isConflict());
    }

    private void requireApprovers(ApprovalRequest request, int level, AppRole role) {
        if (approverDirectory.findEligibleApprovers(role, request.getScopeType(), request.getScopeId()).isEmpty()) {
            throw new NoApproverConfiguredException(request.getScopeType(), request.getScopeId(), level, role);
        }
    }

    private void requireRequester(ApprovalRequest request, String userId) {
        if (!request.getRequesterId().equals(userId)) {
            throw new NotRequesterException(userId, request.getId());
        }
    }

    private void requireStatus(ApprovalRequest request, ApprovalStatus expected, String action) {
        if (request.getStatus() == expected) {
            return;
        }
        if (request.getStatus().isTerminal()) {
            throw new RequestAlreadyTerminalException(request.getId(), request.getStatus());
        }
        throw new InvalidTransitionException(request.getId(), String.format(
                "요청 %d 은(는) %s 상태이므로 %s 할 수 없습니다", request.getId(), request.getStatusLabel(), action));
    }

    /**
     * 동시 결정으로 버전이 어긋나면 같은 단계의 중복 결정으로 본다
     */
    private ApprovalRequest persist(ApprovalRequest request, int level) {
        try {
            return approvalRequestRepository.saveAndFlush(request);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("동시 수정 감지: requestId={}, level={}", request.getId(), level);
            if (level > 0) {
                throw new DuplicateDecisionException(request.getId(), level);
            }
            throw new InvalidTransitionException(request.getId(), "다른 작업이 먼저 요청을 변경했습니다.");
        }
    }

    private ApprovalRequest findRequest(Long requestId) {
        return approvalRequestRepository.findById(requestId)
                .orElseThrow(() -> new EntityNotFoundException("결재 요청을 찾을 수 없습니다: " + requestId));
    }
}
