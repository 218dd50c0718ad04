package workhub.workhubbackend.realtime;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import workhub.workhubbackend.config.CacheConfig;
import workhub.workhubbackend.service.access.ModuleAccessSession;

import java.util.ArrayList;
import java.util.List;

/**
 * 레코드 변경 신호를 받아 파생 캐시를 무효화한다. 값을 직접 계산하지 않고 stale 표시/삭제만 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvalidationBridge {

    private final RecordChangeBus recordChangeBus;
    private final CacheManager cacheManager;
    private final List<Subscription> subscriptions = new ArrayList<>();

    @PostConstruct
    public void start() {
        subscriptions.add(recordChangeBus.subscribe(EntityKind.ROLE_ASSIGNMENT, this::onRoleAssignmentChanged));
        subscriptions.add(recordChangeBus.subscribe(EntityKind.APPROVAL_REQUEST, this::onApprovalChanged));
        subscriptions.add(recordChangeBus.subscribe(EntityKind.APPROVAL_STEP, this::onApprovalChanged));
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
    }

    /**
     * 세션을 역할/모듈 권한 변경에 연결. 반환된 구독은 세션 해제 시 닫는다.
     */
    public Subscription attach(ModuleAccessSession session) {
        String userId = session.getUserId();
        RecordChangeListener markStale = event -> {
            if (event.affects(userId)) {
                log.debug("모듈 권한 stale 표시: userId={}, cause={}", userId, event);
                session.markStale();
            }
        };
        return Subscription.of(
                recordChangeBus.subscribe(EntityKind.ROLE_ASSIGNMENT, markStale),
                recordChangeBus.subscribe(EntityKind.MODULE_GRANT, markStale));
    }

    private void onRoleAssignmentChanged(RecordChangeEvent event) {
        evict(CacheConfig.USER_ROLE_CACHE, event.getSubjectId());
    }

    private void onApprovalChanged(RecordChangeEvent event) {
        evict(CacheConfig.APPROVAL_VIEW_CACHE, event.subject().map(Long::valueOf).orElse(null));
    }

    private void evict(String cacheName, Object key) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return;
        }
        if (key == null) {
            cache.clear();
        } else {
            cache.evict(key);
        }
        log.debug("캐시 무효화: cache={}, key={}", cacheName, key != null ? key : "*");
    }
}
