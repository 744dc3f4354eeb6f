package com.example.fishbowl.global.error;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TurnOrderIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityException(TurnOrderIntegrityException e) {
        log.error("TurnOrderIntegrityException: {}", e.getDetails(), e);
        return toResponse(e);
    }

    @ExceptionHandler(CommonException.class)
    public ResponseEntity<ErrorResponse> handleCommonException(CommonException e) {
        log.warn("CommonException: {} {}", e.getErrorCode().getCode(), e.getDetails());
        return toResponse(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        log.warn("요청 검증 실패: {}", details);
        return toResponse(ErrorCode.INVALID_REQUEST.commonException(details));
    }

    /**
     * 같은 게임에 대한 동시 갱신이 재시도 후에도 충돌한 경우
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockException(ObjectOptimisticLockingFailureException e) {
        log.warn("낙관적 락 충돌, 재시도 소진: {}", e.getMessage());
        return toResponse(ErrorCode.INVALID_GAME_STATE.commonException(Map.of("reason", "concurrent update")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        ErrorResponse response = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("Internal Server Error")
                .details(Map.of())
                .build();
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> toResponse(CommonException e) {
        ErrorCode errorCode = e.getErrorCode();
        ErrorResponse response = ErrorResponse.builder()
                .code(errorCode.getCode())
                .type(errorCode.getType())
                .message(errorCode.getMessage())
                .details(e.getDetails())
                .build();
        return new ResponseEntity<>(response, errorCode.getStatus());
    }
}
