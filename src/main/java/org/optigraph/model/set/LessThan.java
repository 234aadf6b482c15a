package org.optigraph.model.set;

import lombok.Value;

@Value
public class LessThan implements ScalarSet {
    double upper;

    @Override
    public SetShape shape() {
        return SetShape.LESS_THAN;
    }

    @Override
    public LessThan shift(double delta) {
        return new LessThan(upper + delta);
    }

    @Override
    public String toString() {
        return "<= " + upper;
    }
}
