package workhub.workhubbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.enums.AppRole;

@Getter
public class ScopeResolutionException extends WorkhubException {

    private final String userId;
    private final AppRole role;
    private final Long assignmentId;

    public ScopeResolutionException(String userId, AppRole role, Long assignmentId) {
        super(ResponseCode.SCOPE_RESOLUTION_ERROR, HttpStatus.CONFLICT,
                String.format("역할 할당 %d (%s, %s)의 %s 포인터가 비어 있습니다",
                        assignmentId, userId, role.getValue(), role.getAuthoritativeScope().getValue()));
        this.userId = userId;
        this.role = role;
        this.assignmentId = assignmentId;
    }
}
