package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Spread of one pipeline component's load across MPP ranks.
 *
 * @param coefficientOfVariation population standard deviation / mean
 */
public record ComponentImbalance(
    String component,
    int ranks,
    double meanSeconds,
    double maximumSeconds,
    int busiestRank,
    double coefficientOfVariation
) implements Serializable {}
