package workhub.workhubbackend.realtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.entity.mysql.approval.ApprovalStep;
import workhub.workhubbackend.enums.AppRole;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RecordChangeEntityListenerTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private RecordChangeEntityListener listener;

    @Test
    @DisplayName("역할 할당 저장 시 사용자 ID가 담긴 이벤트를 발행한다")
    void publishesRoleAssignmentInsert() {
        UserRoleEntity assignment = new UserRoleEntity("u1", AppRole.DEPARTMENT_HEAD, null, null, "D42");

        listener.onInsert(assignment);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue())
                .isEqualTo(new RecordChangeEvent(EntityKind.ROLE_ASSIGNMENT, ChangeKind.INSERT, "u1"));
    }

    @Test
    @DisplayName("결재 단계 변경 이벤트의 대상은 요청 ID이다")
    void approvalStepSubjectIsRequestId() {
        ApprovalRequest request = new ApprovalRequest();
        request.setId(7L);
        ApprovalStep step = new ApprovalStep(1, AppRole.DEPARTMENT_HEAD);
        request.addStep(step);

        listener.onUpdate(step);

        verify(eventPublisher).publishEvent(new RecordChangeEvent(EntityKind.APPROVAL_STEP, ChangeKind.UPDATE, "7"));
    }

    @Test
    @DisplayName("추적 대상이 아닌 엔티티는 무시한다")
    void ignoresUntrackedEntities() {
        listener.onDelete(new Object());

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
