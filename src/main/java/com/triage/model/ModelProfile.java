package com.triage.model;

import lombok.Builder;
import lombok.Value;

/**
 * One routable backend model tier.
 */
@Value
@Builder
public class ModelProfile {

    /**
     * Catalog key, e.g. "simple".
     */
    String name;

    /**
     * Identifier passed to the inference backend, e.g. "mistral".
     */
    String model;

    /**
     * Maximum adjusted risk score this tier accepts, in (0, 1].
     */
    double threshold;

    /**
     * Complexity floor below which this tier is not eligible.
     */
    double minComplexity;

    /**
     * Relative cost unit, at least 1.
     */
    int resourceIntensity;
}
