package com.optionpricer.domain.model;

import lombok.Value;

/**
 * Lattice price and the one-step finite-difference delta taken from the first branching of
 * the tree. Delta is unitless and negative for puts.
 */
@Value
public class LatticeResult {

    double price;
    double delta;
}
