package com.optionpricer.domain.model;

import com.optionpricer.exception.InvalidArgumentException;

/**
 * Shared constraint checks for the parameter value objects. A NaN input fails every
 * positivity check, so the comparisons are written as negated lower bounds.
 */
final class ParameterChecks {

    private ParameterChecks() {}

    static double requirePositive(String parameter, double value, String message) {
        if (!(value > 0)) {
            throw InvalidArgumentException.forParameter(parameter, value, message);
        }
        return value;
    }

    static int requirePositive(String parameter, int value, String message) {
        if (value <= 0) {
            throw InvalidArgumentException.forParameter(parameter, value, message);
        }
        return value;
    }

    static double requireNonNegative(String parameter, double value, String message) {
        if (!(value >= 0)) {
            throw InvalidArgumentException.forParameter(parameter, value, message);
        }
        return value;
    }

    static double requireFinite(String parameter, double value, String message) {
        if (!Double.isFinite(value)) {
            throw InvalidArgumentException.forParameter(parameter, value, message);
        }
        return value;
    }

    static <T> T requireNonNull(String parameter, T value, String message) {
        if (value == null) {
            throw InvalidArgumentException.forParameter(parameter, null, message);
        }
        return value;
    }
}
