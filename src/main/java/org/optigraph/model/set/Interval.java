package org.optigraph.model.set;

import lombok.Value;

/**
 * Closed interval {@code [lower, upper]}.
 */
@Value
public class Interval implements ScalarSet {
    double lower;
    double upper;

    public Interval(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("lower must be <= upper, got [" + lower + ", " + upper + "]");
        }
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public SetShape shape() {
        return SetShape.INTERVAL;
    }

    @Override
    public Interval shift(double delta) {
        return new Interval(lower + delta, upper + delta);
    }

    @Override
    public String toString() {
        return "in [" + lower + ", " + upper + "]";
    }
}
