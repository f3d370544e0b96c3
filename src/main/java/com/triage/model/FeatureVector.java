package com.triage.model;

import java.util.Arrays;

/**
 * Fixed-length numeric representation of a query.
 *
 * Layout: {@code termDimensions} TF-IDF weights (one slot per vocabulary position,
 * zero-padded when the fitted vocabulary is smaller), followed by the scalar
 * features in {@link Scalar} order.
 */
public final class FeatureVector {

    /**
     * Derived scalar features appended after the term weights.
     */
    public enum Scalar {
        CHAR_LENGTH,
        TOKEN_COUNT,
        AVG_TOKEN_LENGTH,
        PUNCTUATION_DENSITY,
        RARE_TOKEN_COUNT
    }

    public static final int SCALAR_COUNT = Scalar.values().length;

    private final double[] values;
    private final int termDimensions;

    public FeatureVector(double[] values, int termDimensions) {
        if (termDimensions < 0 || values.length != termDimensions + SCALAR_COUNT) {
            throw new IllegalArgumentException("Expected " + (termDimensions + SCALAR_COUNT)
                    + " values for " + termDimensions + " term dimensions, got " + values.length);
        }
        this.values = values.clone();
        this.termDimensions = termDimensions;
    }

    public static int dimensionFor(int termDimensions) {
        return termDimensions + SCALAR_COUNT;
    }

    public int dimension() {
        return values.length;
    }

    public int termDimensions() {
        return termDimensions;
    }

    public double get(int index) {
        return values[index];
    }

    public double scalar(Scalar scalar) {
        return values[termDimensions + scalar.ordinal()];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        FeatureVector that = (FeatureVector) o;
        return termDimensions == that.termDimensions && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + termDimensions;
    }

    @Override
    public String toString() {
        return "FeatureVector{dimension=" + values.length
                + ", tokens=" + scalar(Scalar.TOKEN_COUNT)
                + ", rare=" + scalar(Scalar.RARE_TOKEN_COUNT) + "}";
    }
}
