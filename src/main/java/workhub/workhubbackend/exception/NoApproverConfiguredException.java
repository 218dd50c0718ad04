package workhub.workhubbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;

@Getter
public class NoApproverConfiguredException extends WorkhubException {

    private final ScopeType scopeType;
    private final String scopeId;
    private final int level;

    public NoApproverConfiguredException(ScopeType scopeType, String scopeId, int level, AppRole requiredRole) {
        super(ResponseCode.NO_APPROVER_CONFIGURED, HttpStatus.UNPROCESSABLE_ENTITY,
                String.format("%s %s 에 %d단계 결재자(%s)가 없습니다", scopeType.getValue(), scopeId, level,
                        requiredRole != null ? requiredRole.getValue() : "미설정"));
        this.scopeType = scopeType;
        this.scopeId = scopeId;
        this.level = level;
    }
}
