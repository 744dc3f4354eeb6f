package com.example.fishbowl.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

@Getter
public class CommonException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public CommonException(ErrorCode errorCode) {
        this(errorCode, Collections.emptyMap());
    }

    public CommonException(ErrorCode errorCode, Map<String, Object> details) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorType getType() {
        return errorCode.getType();
    }
}
