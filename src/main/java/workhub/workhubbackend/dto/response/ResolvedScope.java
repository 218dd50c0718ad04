package workhub.workhubbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;

/**
 * 역할 할당 하나에서 계산된 유효 범위
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ResolvedScope {
    private final ScopeType scopeType;
    private final String scopeId; // GLOBAL이면 null, SELF이면 사용자 ID
    private final AppRole role;
    private final Long assignmentId;

    public boolean isGlobal() {
        return scopeType == ScopeType.GLOBAL;
    }
}
