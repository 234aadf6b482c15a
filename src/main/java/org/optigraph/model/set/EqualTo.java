package org.optigraph.model.set;

import lombok.Value;

@Value
public class EqualTo implements ScalarSet {
    double value;

    @Override
    public SetShape shape() {
        return SetShape.EQUAL_TO;
    }

    @Override
    public EqualTo shift(double delta) {
        return new EqualTo(value + delta);
    }

    @Override
    public String toString() {
        return "== " + value;
    }
}
