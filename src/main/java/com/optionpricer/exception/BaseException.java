package com.optionpricer.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of every pricing failure. Failures are raised before any computation starts, so the
 * exception never wraps a cause; {@link #getDetails()} holds the offending values instead
 * (parameter name and value, expression position, requested and allowed work).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        // values may be null (a missing option kind), so no Map.copyOf
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Machine-readable code of {@link #getErrorCode()}, as printed by front ends. */
    public String getCode() {
        return errorCode.getCode();
    }

    public Object getDetail(String key) {
        return details.get(key);
    }
}
