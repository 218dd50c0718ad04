package workhub.workhubbackend.service.access;

import lombok.extern.slf4j.Slf4j;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.realtime.InvalidationBridge;
import workhub.workhubbackend.realtime.Subscription;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 사용자 한 명의 모듈 권한 상태.
 * 판정 메서드는 마지막으로 로딩된 매트릭스만 읽으며 로딩 전에는 항상 false.
 * 무효화 신호를 받으면 stale로 표시되고 다음 조회 시 백그라운드로 다시 로딩한다.
 */
@Slf4j
public class ModuleAccessSession {

    private final ModuleAccessService moduleAccessService;
    private final InvalidationBridge invalidationBridge;

    private String userId;
    private volatile CapabilityMatrix matrix;
    private volatile boolean stale;
    private CompletableFuture<CapabilityMatrix> inFlight;
    private Subscription subscription;
    private long generation;    // 사용자 변경/해제 시 증가
    private long invalidations; // markStale 호출 횟수

    public ModuleAccessSession(ModuleAccessService moduleAccessService, InvalidationBridge invalidationBridge) {
        this.moduleAccessService = moduleAccessService;
        this.invalidationBridge = invalidationBridge;
    }

    public synchronized CompletableFuture<CapabilityMatrix> init(String userId) {
        Objects.requireNonNull(userId, "userId");
        if (userId.equals(this.userId)) {
            if (inFlight != null) {
                return inFlight;
            }
            if (matrix != null && !stale) {
                return CompletableFuture.completedFuture(matrix);
            }
            return reload();
        }
        release();
        this.userId = userId;
        this.subscription = invalidationBridge.attach(this);
        return reload();
    }

    public synchronized void dispose() {
        release();
        this.userId = null;
    }

    /**
     * 명시적 재조회
     */
    public synchronized CompletableFuture<CapabilityMatrix> reload() {
        if (userId == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("초기화되지 않은 세션입니다."));
        }
        long requestGeneration = generation;
        long requestInvalidations = invalidations;
        CompletableFuture<CapabilityMatrix> future = moduleAccessService.loadAccess(userId);
        inFlight = future;
        future.whenComplete((loaded, error) -> onLoaded(future, requestGeneration, requestInvalidations, loaded, error));
        return future;
    }

    public synchronized void markStale() {
        invalidations++;
        stale = true;
    }

    public boolean hasAccess(ModuleKey moduleKey) {
        return allows(moduleKey, Capability.VIEW);
    }

    public boolean canEdit(ModuleKey moduleKey) {
        return allows(moduleKey, Capability.EDIT);
    }

    public boolean canDelete(ModuleKey moduleKey) {
        return allows(moduleKey, Capability.DELETE);
    }

    public boolean canAdmin(ModuleKey moduleKey) {
        return allows(moduleKey, Capability.ADMIN);
    }

    /**
     * 카탈로그에 없는 키는 항상 false
     */
    public boolean allows(String moduleKey, Capability capability) {
        return ModuleKey.fromKey(moduleKey)
                .map(key -> allows(key, capability))
                .orElse(false);
    }

    public boolean allows(ModuleKey moduleKey, Capability capability) {
        if (moduleKey == null || capability == null) {
            return false;
        }
        refreshIfStale();
        CapabilityMatrix current = matrix;
        return current != null && current.allows(moduleKey, capability);
    }

    /**
     * 서버 측 가드용. 로딩되지 않았거나 stale이면 로딩이 끝날 때까지 기다린다.
     */
    public CapabilityMatrix ensureLoaded() {
        CompletableFuture<CapabilityMatrix> pending;
        synchronized (this) {
            if (matrix != null && !stale) {
                return matrix;
            }
            pending = inFlight != null ? inFlight : reload();
        }
        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public Optional<CapabilityMatrix> snapshot() {
        return Optional.ofNullable(matrix);
    }

    public synchronized String getUserId() {
        return userId;
    }

    public boolean isLoaded() {
        return matrix != null;
    }

    public boolean isStale() {
        return stale;
    }

    private void refreshIfStale() {
        if (!stale) {
            return;
        }
        synchronized (this) {
            if (!stale || inFlight != null || userId == null) {
                return;
            }
            try {
                reload();
            } catch (RuntimeException e) {
                // 판정 메서드는 실패하지 않는다. 다음 조회 때 다시 시도
                log.warn("모듈 권한 재로딩 요청 실패: userId={}, {}", userId, e.getMessage());
            }
        }
    }

    private synchronized void onLoaded(CompletableFuture<CapabilityMatrix> future, long requestGeneration,
                                       long requestInvalidations, CapabilityMatrix loaded, Throwable error) {
        if (inFlight == future) {
            inFlight = null;
        }
        if (requestGeneration != generation) {
            return;
        }
        if (error != null) {
            log.error("모듈 권한 로딩 실패: userId={}", userId, error);
            return;
        }
        matrix = loaded;
        // 로딩 중 무효화 신호가 왔으면 stale 유지
        stale = requestInvalidations != invalidations;
    }

    private void release() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        generation++;
        inFlight = null;
        matrix = null;
        stale = false;
    }
}
