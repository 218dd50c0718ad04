package workhub.workhubbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import workhub.workhubbackend.common.ResponseCode;

@Getter
public class InvalidTransitionException extends WorkhubException {

    private final Long requestId;

    public InvalidTransitionException(Long requestId, String message) {
        this(ResponseCode.INVALID_TRANSITION, requestId, message);
    }

    protected InvalidTransitionException(String code, Long requestId, String message) {
        super(code, HttpStatus.CONFLICT, message);
        this.requestId = requestId;
    }
}
