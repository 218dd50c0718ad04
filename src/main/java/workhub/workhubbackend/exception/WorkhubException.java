package workhub.workhubbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 호출자에게 그대로 전달되는 도메인 오류. code는 {@link workhub.workhubbackend.common.ResponseCode} 값.
 */
@Getter
public abstract class WorkhubException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected WorkhubException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
