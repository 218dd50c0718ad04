package workhub.workhubbackend.exception;

import lombok.Getter;
import workhub.workhubbackend.common.ResponseCode;

@Getter
public class DuplicateDecisionException extends InvalidTransitionException {

    private final int level;

    public DuplicateDecisionException(Long requestId, int level) {
        super(ResponseCode.DUPLICATE_DECISION, requestId,
                String.format("요청 %d 의 %d단계는 이미 결정되었습니다", requestId, level));
        this.level = level;
    }
}
