package workhub.workhubbackend.handler;

import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.common.ResponseMessage;
import workhub.workhubbackend.dto.response.ErrorResponseDto;
import workhub.workhubbackend.exception.WorkhubException;

import java.util.stream.Collectors;

/**
 * 오류 종류별로 서로 다른 코드/상태를 돌려 화면에서 실패 이유를 구분할 수 있게 한다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkhubException.class)
    public ResponseEntity<ErrorResponseDto> handleWorkhubException(WorkhubException e) {
        log.info("요청 거부: code={}, message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getStatus()).body(new ErrorResponseDto(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(EntityNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponseDto(ResponseCode.NOT_FOUND,
                        e.getMessage() != null ? e.getMessage() : ResponseMessage.NOT_FOUND));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto(ResponseCode.VALIDATION_FAIL, detail.isEmpty() ? ResponseMessage.VALIDATION_FAIL : detail));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto(ResponseCode.VALIDATION_FAIL, e.getMessage()));
    }

    // 저장소 오류는 재시도하지 않고 그대로 실패로 돌려준다
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponseDto> handleDataAccess(DataAccessException e) {
        log.error("데이터베이스 오류", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponseDto(ResponseCode.DATABASE_ERROR, ResponseMessage.DATABASE_ERROR));
    }
}
