package com.optionpricer.exception;

import java.util.Map;

/**
 * Raised by the pricing facade when a request's step or step-times-path count is above the
 * configured ceiling. The algorithms have no internal early exit, so this is the only
 * latency bound available to callers.
 */
public class PricingBudgetExceededException extends BaseException {

    public PricingBudgetExceededException(String message, long requested, long limit) {
        super(ErrorCode.PRICING_BUDGET_EXCEEDED, message, Map.of("requested", requested, "limit", limit));
    }
}
