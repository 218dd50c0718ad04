package workhub.workhubbackend.exception;

import lombok.Getter;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;

@Getter
public class ModuleAccessDeniedException extends ActionDeniedException {

    private final String userId;
    private final ModuleKey moduleKey;
    private final Capability capability;

    public ModuleAccessDeniedException(String userId, ModuleKey moduleKey, Capability capability) {
        super(ResponseCode.MODULE_ACCESS_DENIED,
                String.format("사용자 %s 에게 %s 모듈 %s 권한이 없습니다", userId, moduleKey.getKey(), capability));
        this.userId = userId;
        this.moduleKey = moduleKey;
        this.capability = capability;
    }
}
