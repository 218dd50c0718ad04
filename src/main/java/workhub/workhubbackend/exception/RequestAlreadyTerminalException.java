package workhub.workhubbackend.exception;

import lombok.Getter;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.enums.approval.ApprovalStatus;

@Getter
public class RequestAlreadyTerminalException extends InvalidTransitionException {

    private final ApprovalStatus requestStatus;

    public RequestAlreadyTerminalException(Long requestId, ApprovalStatus status) {
        super(ResponseCode.REQUEST_ALREADY_TERMINAL, requestId,
                String.format("요청 %d 은(는) 이미 종료되었습니다 (%s)", requestId, status.name().toLowerCase()));
        this.requestStatus = status;
    }
}
