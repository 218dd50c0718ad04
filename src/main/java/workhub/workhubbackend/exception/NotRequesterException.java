package workhub.workhubbackend.exception;

import lombok.Getter;
import workhub.workhubbackend.common.ResponseCode;

@Getter
public class NotRequesterException extends ActionDeniedException {

    private final String userId;
    private final Long requestId;

    public NotRequesterException(String userId, Long requestId) {
        super(ResponseCode.NOT_REQUESTER,
                String.format("요청 %d 은(는) 신청자만 처리할 수 있습니다 (userId=%s)", requestId, userId));
        this.userId = userId;
        this.requestId = requestId;
    }
}
