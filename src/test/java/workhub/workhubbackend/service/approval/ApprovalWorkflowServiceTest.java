package workhub.workhubbackend.service.approval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.config.ApprovalProperties;
import workhub.workhubbackend.dto.approval.ApprovalActionResult;
import workhub.workhubbackend.dto.approval.ApprovalRequestViewDto;
import workhub.workhubbackend.dto.approval.ApprovalStepDto;
import workhub.workhubbackend.dto.approval.ConflictReport;
import workhub.workhubbackend.dto.request.CreateApprovalRequestDto;
import workhub.workhubbackend.dto.response.NotificationResult;
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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalWorkflowServiceTest {

    private static final Long REQUEST_ID = 7L;
    private static final String REQUESTER = "u9";

    @Mock
    private ApprovalRequestRepository approvalRequestRepository;
    @Mock
    private ApproverDirectory approverDirectory;
    @Mock
    private ScopeResolver scopeResolver;
    @Mock
    private OrganizationService organizationService;
    @Mock
    private ConflictDetector conflictDetector;
    @Mock
    private ApprovalNotifier approvalNotifier;

    private ApprovalProperties approvalProperties;
    private ApprovalWorkflowService workflowService;

    @BeforeEach
    void setUp() {
        approvalProperties = new ApprovalProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T09:00:00Z"), ZoneOffset.UTC);
        ApprovalTransitionService transitionService = new ApprovalTransitionService(approvalRequestRepository,
                approvalProperties, approverDirectory, scopeResolver, organizationService, conflictDetector, clock);
        workflowService = new ApprovalWorkflowService(transitionService, approvalNotifier);

        lenient().when(approvalRequestRepository.saveAndFlush(any(ApprovalRequest.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(conflictDetector.evaluate(any())).thenReturn(report(List.of()));
        lenient().when(approvalNotifier.notifyApprovers(any(), any()))
                .thenReturn(List.of(NotificationResult.success("h1", "vacation", REQUEST_ID, "휴가 계획 결재 요청", "ok")));
        lenient().when(approvalNotifier.notifyApproved(any()))
                .thenReturn(List.of(NotificationResult.success(REQUESTER, "vacation", REQUEST_ID, "휴가 계획 승인", "ok")));
        lenient().when(approvalNotifier.notifyRejected(any(), any()))
                .thenReturn(List.of(NotificationResult.success(REQUESTER, "vacation", REQUEST_ID, "휴가 계획 반려", "ok")));
        lenient().when(approverDirectory.findEligibleApprovers(any(), any(), anyString())).thenReturn(List.of("h1"));
    }

    private static ConflictReport report(List<LocalDate> shortStaffedDays) {
        return ConflictReport.builder()
                .requestId(REQUEST_ID)
                .staffCount(5)
                .minimumCoverage(3)
                .overlaps(List.of())
                .shortStaffedDays(shortStaffedDays)
                .build();
    }

    private ApprovalRequest draft() {
        ApprovalRequest request = new ApprovalRequest();
        request.setId(REQUEST_ID);
        request.setRequesterId(REQUESTER);
        request.setScopeType(ScopeType.DEPARTMENT);
        request.setScopeId("D42");
        request.setStartDate(LocalDate.of(2024, 6, 10));
        request.setEndDate(LocalDate.of(2024, 6, 15));
        when(approvalRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        return request;
    }

    private ApprovalRequest inReview(int currentLevel) {
        ApprovalRequest request = draft();
        request.addStep(new ApprovalStep(1, AppRole.DEPARTMENT_HEAD));
        request.addStep(new ApprovalStep(2, AppRole.FACILITY_SUPERVISOR));
        request.addStep(new ApprovalStep(3, AppRole.WORKPLACE_SUPERVISOR));
        for (int level = 1; level < currentLevel; level++) {
            request.findStep(level).get().setDecision(ApprovalDecision.APPROVED);
        }
        request.setMaxLevel(3);
        request.setStatus(ApprovalStatus.IN_REVIEW);
        request.setCurrentLevel(currentLevel);
        return request;
    }

    private void allowAllScopes() {
        when(scopeResolver.canActOn(anyString(), any(), any(), anyString())).thenReturn(true);
    }

    @Test
    @DisplayName("부서 요청은 부서장, 시설 감독자, 사업장 감독자 순으로 승인되어 최종 승인된다")
    void threeLevelApproval() {
        draft();
        allowAllScopes();

        ApprovalActionResult submitted = workflowService.submit(REQUEST_ID, REQUESTER);
        assertThat(submitted.getRequest().getStatus()).isEqualTo("level_1_pending");
        assertThat(submitted.getRequest().getMaxLevel()).isEqualTo(3);
        assertThat(submitted.getRequest().getSteps())
                .extracting(ApprovalStepDto::getApproverRole)
                .containsExactly("department_head", "facility_supervisor", "workplace_supervisor");
        assertThat(submitted.getNotifications()).hasSize(1);

        assertThat(workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1", null, null)
                .getRequest().getStatus()).isEqualTo("level_2_pending");
        assertThat(workflowService.decide(REQUEST_ID, 2, ApprovalDecision.APPROVED, "f1", null, null)
                .getRequest().getStatus()).isEqualTo("level_3_pending");

        ApprovalActionResult done = workflowService.decide(REQUEST_ID, 3, ApprovalDecision.APPROVED, "w1", "확인", null);

        ApprovalRequestViewDto view = done.getRequest();
        assertThat(view.getStatus()).isEqualTo("fully_approved");
        assertThat(view.getCurrentLevel()).isNull();
        assertThat(view.getCompletedAt()).isNotNull();
        assertThat(view.getSteps()).extracting(ApprovalStepDto::getDecidedBy).containsExactly("h1", "f1", "w1");
        verify(approvalNotifier).notifyApproved(any());
    }

    @Test
    @DisplayName("1단계 전에 2단계를 결정하면 InvalidTransition")
    void decidingAheadOfCurrentLevelFails() {
        ApprovalRequest request = inReview(1);

        assertThatThrownBy(() -> workflowService.decide(REQUEST_ID, 2, ApprovalDecision.APPROVED, "f1", null, null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(request.getCurrentLevel()).isEqualTo(1);
        verify(approvalRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("이미 결정된 단계를 다시 결정하면 DuplicateDecision")
    void duplicateDecisionFails() {
        inReview(2);

        assertThatThrownBy(() -> workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1", null, null))
                .isInstanceOf(DuplicateDecisionException.class);
    }

    @Test
    @DisplayName("반려되면 남은 단계는 pending 으로 남고 이후 결정은 RequestAlreadyTerminal")
    void rejectionIsTerminal() {
        inReview(1);
        allowAllScopes();

        ApprovalActionResult rejected = workflowService.decide(REQUEST_ID, 1, ApprovalDecision.REJECTED, "h1", "인원 부족", null);

        assertThat(rejected.getRequest().getStatus()).isEqualTo("rejected");
        assertThat(rejected.getRequest().getSteps())
                .extracting(ApprovalStepDto::getDecision)
                .containsExactly("rejected", "pending", "pending");
        verify(approvalNotifier).notifyRejected(any(), any());

        assertThatThrownBy(() -> workflowService.decide(REQUEST_ID, 2, ApprovalDecision.APPROVED, "f1", null, null))
                .isInstanceOf(RequestAlreadyTerminalException.class);
    }

    @Test
    @DisplayName("범위 밖 결재자의 결정은 ScopeAccessDenied")
    void approverOutsideScopeIsDenied() {
        inReview(1);
        when(scopeResolver.canActOn("h2", AppRole.DEPARTMENT_HEAD, ScopeType.DEPARTMENT, "D42")).thenReturn(false);

        assertThatThrownBy(() -> workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h2", null, null))
                .isInstanceOf(ScopeAccessDeniedException.class);
        verify(approvalRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("1단계 결재자가 없으면 제출할 수 없다")
    void submitWithoutApproverFails() {
        draft();
        when(approverDirectory.findEligibleApprovers(AppRole.DEPARTMENT_HEAD, ScopeType.DEPARTMENT, "D42"))
                .thenReturn(List.of());

        assertThatThrownBy(() -> workflowService.submit(REQUEST_ID, REQUESTER))
                .isInstanceOf(NoApproverConfiguredException.class);
        verify(approvalRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("auto-route 를 끄면 submitted 에 머물고 route 로 1단계에 보낸다")
    void manualRouting() {
        approvalProperties.setAutoRoute(false);
        draft();

        ApprovalActionResult submitted = workflowService.submit(REQUEST_ID, REQUESTER);
        assertThat(submitted.getRequest().getStatus()).isEqualTo("submitted");
        assertThat(submitted.getNotifications()).isEmpty();

        ApprovalActionResult routed = workflowService.route(REQUEST_ID, REQUESTER);
        assertThat(routed.getRequest().getStatus()).isEqualTo("level_1_pending");
    }

    @Test
    @DisplayName("신청자만 제출할 수 있다")
    void onlyRequesterSubmits() {
        draft();

        assertThatThrownBy(() -> workflowService.submit(REQUEST_ID, "someone"))
                .isInstanceOf(NotRequesterException.class);
    }

    @Test
    @DisplayName("draft 는 취소할 수 있지만 결재 진행 중이면 InvalidTransition")
    void cancelRules() {
        draft();

        assertThat(workflowService.cancel(REQUEST_ID, REQUESTER).getStatus()).isEqualTo("cancelled");
        assertThatThrownBy(() -> workflowService.cancel(REQUEST_ID, REQUESTER))
                .isInstanceOf(RequestAlreadyTerminalException.class);
    }

    @Test
    @DisplayName("결재 진행 중인 요청은 취소할 수 없다")
    void cannotCancelInReview() {
        inReview(2);

        assertThatThrownBy(() -> workflowService.cancel(REQUEST_ID, REQUESTER))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("동시 결정으로 버전 충돌이 나면 DuplicateDecision")
    void optimisticLockFailureBecomesDuplicate() {
        inReview(1);
        allowAllScopes();
        when(approvalRequestRepository.saveAndFlush(any(ApprovalRequest.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(ApprovalRequest.class, REQUEST_ID));

        assertThatThrownBy(() -> workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1", null, null))
                .isInstanceOf(DuplicateDecisionException.class);
        verify(approvalNotifier, never()).notifyApprovers(any(), any());
    }

    @Test
    @DisplayName("최소 인원 미달이어도 반려하지 않고 충돌만 표시한다")
    void conflictIsFlaggedNotRejected() {
        inReview(1);
        allowAllScopes();
        when(conflictDetector.evaluate(any())).thenReturn(report(List.of(LocalDate.of(2024, 6, 10))));

        ApprovalActionResult result = workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1",
                null, "대체 인력 확보");

        assertThat(result.getRequest().getStatus()).isEqualTo("level_2_pending");
        assertThat(result.getRequest().isHasConflict()).isTrue();
        assertThat(result.getRequest().getSteps().get(0).isHasConflict()).isTrue();
        assertThat(result.getRequest().getSteps().get(0).getConflictReason()).isEqualTo("대체 인력 확보");
    }

    @Test
    @DisplayName("알림 실패는 전이를 되돌리지 않고 결과에 담긴다")
    void notificationFailureIsReported() {
        inReview(1);
        allowAllScopes();
        when(approvalNotifier.notifyApprovers(any(), any()))
                .thenReturn(List.of(NotificationResult.fail("f1", "vacation", REQUEST_ID, "휴가 계획 결재 요청", "HTTP 502")));

        ApprovalActionResult result = workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1", null, null);

        assertThat(result.getRequest().getStatus()).isEqualTo("level_2_pending");
        assertThat(result.getDispatchErrors()).singleElement()
                .extracting(NotificationResult::getErrorMessage)
                .isEqualTo("HTTP 502");
    }

    @Test
    @DisplayName("알림은 전이가 저장된 뒤에 보낸다")
    void notificationsFollowPersistedTransition() {
        inReview(1);
        allowAllScopes();

        workflowService.decide(REQUEST_ID, 1, ApprovalDecision.APPROVED, "h1", null, null);

        InOrder order = inOrder(approvalRequestRepository, approvalNotifier);
        order.verify(approvalRequestRepository).saveAndFlush(any(ApprovalRequest.class));
        order.verify(approvalNotifier).notifyApprovers(any(), any());
    }

    @Test
    @DisplayName("상태 전이만 트랜잭션 안에서 실행되고 알림 발송 메서드는 트랜잭션 밖에 있다")
    void notificationDispatchRunsOutsideTransaction() throws NoSuchMethodException {
        Class<?>[] decideParams = {Long.class, int.class, ApprovalDecision.class, String.class, String.class, String.class};

        assertThat(ApprovalWorkflowService.class.isAnnotationPresent(Transactional.class)).isFalse();
        assertThat(ApprovalWorkflowService.class.getMethod("decide", decideParams)
                .isAnnotationPresent(Transactional.class)).isFalse();
        assertThat(ApprovalWorkflowService.class.getMethod("submit", Long.class, String.class)
                .isAnnotationPresent(Transactional.class)).isFalse();
        assertThat(ApprovalTransitionService.class.getMethod("decide", decideParams)
                .isAnnotationPresent(Transactional.class)).isTrue();
        assertThat(ApprovalTransitionService.class.getMethod("submit", Long.class, String.class)
                .isAnnotationPresent(Transactional.class)).isTrue();
    }

    @Test
    @DisplayName("잘못된 기간으로는 요청을 만들 수 없다")
    void createDraftRejectsInvalidRange() {
        CreateApprovalRequestDto dto = new CreateApprovalRequestDto("여름 휴가", "department", "D42",
                LocalDate.of(2024, 6, 15), LocalDate.of(2024, 6, 10));

        assertThatThrownBy(() -> workflowService.createDraft(REQUESTER, dto))
                .isInstanceOf(IllegalArgumentException.class);
        verify(approvalRequestRepository, never()).save(any());
    }

    @Test
    @DisplayName("새 요청은 draft 상태로 저장된다")
    void createDraft() {
        when(approvalRequestRepository.save(any(ApprovalRequest.class))).thenAnswer(invocation -> {
            ApprovalRequest saved = invocation.getArgument(0);
            saved.setId(REQUEST_ID);
            return saved;
        });
        CreateApprovalRequestDto dto = new CreateApprovalRequestDto("여름 휴가", "department", "D42",
                LocalDate.of(2024, 6, 10), LocalDate.of(2024, 6, 15));

        ApprovalRequestViewDto view = workflowService.createDraft(REQUESTER, dto);

        assertThat(view.getId()).isEqualTo(REQUEST_ID);
        assertThat(view.getStatus()).isEqualTo("draft");
        assertThat(view.getScopeType()).isEqualTo("department");
        verify(organizationService).requireExists(ScopeType.DEPARTMENT, "D42");
    }
}
