package workhub.workhubbackend.service.access;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.realtime.InvalidationBridge;
import workhub.workhubbackend.realtime.Subscription;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModuleAccessSessionTest {

    @Mock
    private ModuleAccessService moduleAccessService;
    @Mock
    private InvalidationBridge invalidationBridge;
    @Mock
    private Subscription subscription;

    private ModuleAccessSession session;

    @BeforeEach
    void setUp() {
        lenient().when(invalidationBridge.attach(any())).thenReturn(subscription);
        session = new ModuleAccessSession(moduleAccessService, invalidationBridge);
    }

    private static CapabilityMatrix taskEditor() {
        return new CapabilityMatrix(Map.of(ModuleKey.TASK_MANAGEMENT, new CapabilityFlags(true, true, false, false)), List.of());
    }

    @Test
    @DisplayName("로딩이 끝나기 전에는 모든 판정이 false")
    void falseBeforeLoad() {
        CompletableFuture<CapabilityMatrix> pending = new CompletableFuture<>();
        when(moduleAccessService.loadAccess("u1")).thenReturn(pending);

        session.init("u1");

        assertThat(session.isLoaded()).isFalse();
        assertThat(session.hasAccess(ModuleKey.TASK_MANAGEMENT)).isFalse();

        pending.complete(taskEditor());

        assertThat(session.isLoaded()).isTrue();
        assertThat(session.hasAccess(ModuleKey.TASK_MANAGEMENT)).isTrue();
        assertThat(session.canEdit(ModuleKey.TASK_MANAGEMENT)).isTrue();
        assertThat(session.canDelete(ModuleKey.TASK_MANAGEMENT)).isFalse();
    }

    @Test
    @DisplayName("알 수 없는 모듈 키는 로딩 후에도 false")
    void unknownKeyIsFalse() {
        when(moduleAccessService.loadAccess("u1")).thenReturn(CompletableFuture.completedFuture(taskEditor()));

        session.init("u1");

        assertThat(session.allows("payroll", Capability.VIEW)).isFalse();
        assertThat(session.allows("task_management", Capability.VIEW)).isTrue();
    }

    @Test
    @DisplayName("같은 사용자로 다시 초기화하면 재조회하지 않는다")
    void initIsIdempotent() {
        when(moduleAccessService.loadAccess("u1")).thenReturn(CompletableFuture.completedFuture(taskEditor()));

        session.init("u1");
        CapabilityMatrix again = session.init("u1").join();

        assertThat(again).isEqualTo(taskEditor());
        verify(moduleAccessService, times(1)).loadAccess("u1");
    }

    @Test
    @DisplayName("stale 표시 후 첫 조회는 이전 값을 돌려주고 재로딩을 시작한다")
    void staleReadTriggersReload() {
        CompletableFuture<CapabilityMatrix> refreshed = new CompletableFuture<>();
        when(moduleAccessService.loadAccess("u1"))
                .thenReturn(CompletableFuture.completedFuture(taskEditor()))
                .thenReturn(refreshed);
        session.init("u1");

        session.markStale();

        assertThat(session.isStale()).isTrue();
        assertThat(session.canEdit(ModuleKey.TASK_MANAGEMENT)).isTrue();
        verify(moduleAccessService, times(2)).loadAccess("u1");

        refreshed.complete(CapabilityMatrix.empty());

        assertThat(session.isStale()).isFalse();
        assertThat(session.canEdit(ModuleKey.TASK_MANAGEMENT)).isFalse();
    }

    @Test
    @DisplayName("로딩 중에 무효화가 오면 결과를 반영해도 stale 상태를 유지한다")
    void invalidationDuringLoadKeepsStale() {
        CompletableFuture<CapabilityMatrix> pending = new CompletableFuture<>();
        when(moduleAccessService.loadAccess("u1")).thenReturn(pending);
        session.init("u1");

        session.markStale();
        pending.complete(taskEditor());

        assertThat(session.isLoaded()).isTrue();
        assertThat(session.isStale()).isTrue();
    }

    @Test
    @DisplayName("재로딩이 실패해도 이전 매트릭스를 유지한다")
    void failedReloadKeepsPreviousMatrix() {
        when(moduleAccessService.loadAccess("u1"))
                .thenReturn(CompletableFuture.completedFuture(taskEditor()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("db down")));
        session.init("u1");

        session.reload();

        assertThat(session.snapshot()).contains(taskEditor());
        assertThat(session.canEdit(ModuleKey.TASK_MANAGEMENT)).isTrue();
    }

    @Test
    @DisplayName("사용자가 바뀐 뒤 도착한 이전 사용자의 결과는 버린다")
    void lateResultForPreviousUserIsDiscarded() {
        CompletableFuture<CapabilityMatrix> forU1 = new CompletableFuture<>();
        CompletableFuture<CapabilityMatrix> forU2 = new CompletableFuture<>();
        when(moduleAccessService.loadAccess("u1")).thenReturn(forU1);
        when(moduleAccessService.loadAccess("u2")).thenReturn(forU2);

        session.init("u1");
        session.init("u2");
        forU1.complete(taskEditor());

        assertThat(session.isLoaded()).isFalse();
        assertThat(session.getUserId()).isEqualTo("u2");
        verify(subscription).close();
    }

    @Test
    @DisplayName("해제하면 구독을 닫고 이후 판정은 false")
    void disposeClosesSubscription() {
        when(moduleAccessService.loadAccess("u1")).thenReturn(CompletableFuture.completedFuture(taskEditor()));
        session.init("u1");

        session.dispose();

        verify(subscription).close();
        assertThat(session.hasAccess(ModuleKey.TASK_MANAGEMENT)).isFalse();
        assertThat(session.getUserId()).isNull();
    }

    @Test
    @DisplayName("가드용 ensureLoaded는 로딩 실패를 그대로 던진다")
    void ensureLoadedPropagatesFailure() {
        when(moduleAccessService.loadAccess("u1"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("db down")));
        session.init("u1");

        assertThatThrownBy(() -> session.ensureLoaded())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("db down");
    }
}
