package com.optionpricer.domain.enums;

/**
 * When the holder may exercise. AMERICAN is only supported by the binomial lattice.
 */
public enum ExerciseStyle {
    EUROPEAN,
    AMERICAN
}
