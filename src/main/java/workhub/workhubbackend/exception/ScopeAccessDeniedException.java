package workhub.workhubbackend.exception;

import lombok.Getter;
import workhub.workhubbackend.common.ResponseCode;

@Getter
public class ScopeAccessDeniedException extends ActionDeniedException {

    private final String userId;
    private final Long requestId;

    public ScopeAccessDeniedException(String userId, Long requestId, String reason) {
        super(ResponseCode.SCOPE_ACCESS_DENIED,
                String.format("요청 %d 은(는) 사용자 %s 의 범위가 아닙니다: %s", requestId, userId, reason));
        this.userId = userId;
        this.requestId = requestId;
    }
}
