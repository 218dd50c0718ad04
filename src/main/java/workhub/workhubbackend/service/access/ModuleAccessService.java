package workhub.workhubbackend.service.access;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import workhub.workhubbackend.config.AsyncConfig;
import workhub.workhubbackend.dto.response.UserModuleDto;
import workhub.workhubbackend.enums.ModuleKey;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 사용자 모듈 권한 매트릭스 로딩. 조회는 비동기로 한 번만 수행한다.
 */
@Slf4j
@Service
public class ModuleAccessService {

    private final UserModuleGateway userModuleGateway;
    private final Executor moduleAccessExecutor;

    public ModuleAccessService(UserModuleGateway userModuleGateway,
                               @Qualifier(AsyncConfig.MODULE_ACCESS_EXECUTOR) Executor moduleAccessExecutor) {
        this.userModuleGateway = userModuleGateway;
        this.moduleAccessExecutor = moduleAccessExecutor;
    }

    /**
     * 저장소 오류는 그대로 future의 실패로 전달된다 (재시도 없음)
     */
    public CompletableFuture<CapabilityMatrix> loadAccess(String userId) {
        return CompletableFuture.supplyAsync(() -> toMatrix(userId, userModuleGateway.fetchUserModules(userId)),
                moduleAccessExecutor);
    }

    CapabilityMatrix toMatrix(String userId, List<UserModuleDto> rows) {
        Map<ModuleKey, CapabilityFlags> grants = new EnumMap<>(ModuleKey.class);
        List<String> violations = new ArrayList<>();

        for (UserModuleDto row : rows) {
            Optional<ModuleKey> moduleKey = ModuleKey.fromKey(row.getModuleKey());
            if (moduleKey.isEmpty()) {
                log.warn("알 수 없는 모듈 키는 무시합니다: userId={}, moduleKey={}", userId, row.getModuleKey());
                continue;
            }
            CapabilityFlags flags = new CapabilityFlags(row.isCanView(), row.isCanEdit(), row.isCanDelete(), row.isCanAdmin());
            if (!flags.isConsistent()) {
                String violation = moduleKey.get().getKey() + ": view 권한 없이 " + describe(flags);
                log.warn("모듈 권한 설정 불일치: userId={}, {}", userId, violation);
                violations.add(violation);
            }
            grants.put(moduleKey.get(), flags);
        }

        log.info("모듈 권한 로딩 완료: userId={}, modules={}, violations={}", userId, grants.size(), violations.size());
        return new CapabilityMatrix(grants, violations);
    }

    private String describe(CapabilityFlags flags) {
        List<String> granted = new ArrayList<>();
        if (flags.isEdit()) granted.add("edit");
        if (flags.isDelete()) granted.add("delete");
        if (flags.isAdmin()) granted.add("admin");
        return String.join("/", granted) + " 부여됨";
    }
}
