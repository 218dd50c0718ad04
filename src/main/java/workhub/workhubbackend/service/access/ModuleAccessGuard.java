package workhub.workhubbackend.service.access;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.exception.ModuleAccessDeniedException;

/**
 * 권한이 필요한 작업 직전의 모듈 권한 확인
 */
@Component
@RequiredArgsConstructor
public class ModuleAccessGuard {

    private final ModuleAccessRegistry moduleAccessRegistry;

    public boolean check(String userId, ModuleKey moduleKey, Capability capability) {
        return moduleAccessRegistry.sessionFor(userId).ensureLoaded().allows(moduleKey, capability);
    }

    public void require(String userId, ModuleKey moduleKey, Capability capability) {
        if (!check(userId, moduleKey, capability)) {
            throw new ModuleAccessDeniedException(userId, moduleKey, capability);
        }
    }
}
