package org.optigraph.model.set;

import lombok.Value;

@Value
public class GreaterThan implements ScalarSet {
    double lower;

    @Override
    public SetShape shape() {
        return SetShape.GREATER_THAN;
    }

    @Override
    public GreaterThan shift(double delta) {
        return new GreaterThan(lower + delta);
    }

    @Override
    public String toString() {
        return ">= " + lower;
    }
}
