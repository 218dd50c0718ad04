package workhub.workhubbackend.service.access;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import workhub.workhubbackend.realtime.InvalidationBridge;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 사용자별 {@link ModuleAccessSession} 보관소.
 * idle-timeout 동안 조회되지 않은 세션은 주기적으로 해제되어 무효화 구독도 함께 닫힌다.
 */
@Slf4j
@Component
public class ModuleAccessRegistry {

    private final ModuleAccessService moduleAccessService;
    private final InvalidationBridge invalidationBridge;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

    public ModuleAccessRegistry(ModuleAccessService moduleAccessService,
                                InvalidationBridge invalidationBridge,
                                Clock clock,
                                @Value("${workhub.module-access.idle-timeout:30m}") Duration idleTimeout) {
        this.moduleAccessService = moduleAccessService;
        this.invalidationBridge = invalidationBridge;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    public ModuleAccessSession sessionFor(String userId) {
        Instant now = clock.instant();
        return sessions.compute(userId, (id, existing) -> {
            if (existing != null) {
                existing.lastAccess = now;
                return existing;
            }
            ModuleAccessSession session = new ModuleAccessSession(moduleAccessService, invalidationBridge);
            session.init(id);
            return new SessionEntry(session, now);
        }).session;
    }

    public CompletableFuture<CapabilityMatrix> reload(String userId) {
        return sessionFor(userId).reload();
    }

    public void release(String userId) {
        SessionEntry entry = sessions.remove(userId);
        if (entry != null) {
            entry.session.dispose();
        }
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 마지막 조회 후 idle-timeout 이 지난 세션 해제
     */
    @Scheduled(fixedDelayString = "${workhub.module-access.sweep-interval-ms:60000}")
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (String userId : sessions.keySet()) {
            SessionEntry[] removed = new SessionEntry[1];
            sessions.computeIfPresent(userId, (id, entry) -> {
                if (entry.lastAccess.isBefore(cutoff)) {
                    removed[0] = entry;
                    return null;
                }
                return entry;
            });
            if (removed[0] != null) {
                removed[0].session.dispose();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("유휴 모듈 권한 세션 해제: {}건, 남은 세션={}", evicted, sessions.size());
        }
        return evicted;
    }

    @PreDestroy
    public void releaseAll() {
        sessions.values().forEach(entry -> entry.session.dispose());
        sessions.clear();
        log.info("모듈 권한 세션 정리 완료");
    }

    private static final class SessionEntry {
        private final ModuleAccessSession session;
        private volatile Instant lastAccess;

        private SessionEntry(ModuleAccessSession session, Instant lastAccess) {
            this.session = session;
            this.lastAccess = lastAccess;
        }
    }
}
