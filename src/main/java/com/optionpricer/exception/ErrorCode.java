package com.optionpricer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable failure codes. Every code is a caller error: pricing failures are caused
 * by the supplied parameters, never by transient conditions, so none of them is retryable.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_ARGUMENT("INVALID_ARGUMENT"),
    INVALID_PAYOFF_EXPRESSION("INVALID_PAYOFF_EXPRESSION"),
    PRICING_BUDGET_EXCEEDED("PRICING_BUDGET_EXCEEDED");

    private final String code;
}
