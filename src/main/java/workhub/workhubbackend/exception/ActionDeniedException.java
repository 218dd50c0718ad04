package workhub.workhubbackend.exception;

import org.springframework.http.HttpStatus;

/**
 * 권한 판정이 false인 상태에서 시도한 작업
 */
public abstract class ActionDeniedException extends WorkhubException {

    protected ActionDeniedException(String code, String message) {
        super(code, HttpStatus.FORBIDDEN, message);
    }
}
