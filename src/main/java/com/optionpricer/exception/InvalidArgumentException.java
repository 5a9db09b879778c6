package com.optionpricer.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised before any computation starts when a pricing input violates a constraint.
 * The message names the violated quantity; {@link #getDetails()} carries the parameter
 * name and the rejected value when they are known.
 */
public class InvalidArgumentException extends BaseException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message, Map.of());
    }

    public InvalidArgumentException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static InvalidArgumentException forParameter(String parameter, Object value, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", parameter);
        details.put("value", value);
        return new InvalidArgumentException(ErrorCode.INVALID_ARGUMENT, message, details);
    }

    public static InvalidArgumentException forPayoffValue(double terminalPrice, double value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", "payoff");
        details.put("terminalPrice", terminalPrice);
        details.put("value", value);
        return new InvalidArgumentException(
                ErrorCode.INVALID_ARGUMENT,
                "Payoff returned " + value + " for terminal price " + terminalPrice + "; expected a finite number",
                details);
    }

    public static InvalidArgumentException forExpression(String message, int position) {
        return new InvalidArgumentException(
                ErrorCode.INVALID_PAYOFF_EXPRESSION, message, Map.of("position", position));
    }
}
