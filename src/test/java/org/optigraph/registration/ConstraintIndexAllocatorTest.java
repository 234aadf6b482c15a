package org.optigraph.registration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.optigraph.graph.OptiEdge;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.FunctionShape;
import org.optigraph.model.constraint.ScalarConstraint;
import org.optigraph.model.expr.AffExpr;
import org.optigraph.model.set.SetShape;
import org.optigraph.testutil.GraphFixtures;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ConstraintIndexAllocator Tests")
class ConstraintIndexAllocatorTest {

    @Test
    @DisplayName("Fresh element starts at index 1")
    void testFirstIndex() {
        OptiEdge edge = GraphFixtures.linking().link();

        ConstraintIndex index = ConstraintIndexAllocator.nextIndex(
                edge.graphBackend(), edge, FunctionShape.AFFINE, SetShape.LESS_THAN);

        assertEquals(new ConstraintIndex(ConstraintShape.of(FunctionShape.AFFINE, SetShape.LESS_THAN), 1), index);
        assertEquals(0, ConstraintIndexAllocator.numConstraints(
                edge.graphBackend(), edge, FunctionShape.AFFINE, SetShape.LESS_THAN));
    }

    @Test
    @DisplayName("Counters advance per shape independently")
    void testPerShapeCounters() {
        GraphFixtures.LinkingFixture f = GraphFixtures.linking();
        OptiEdge edge = f.link();
        edge.addConstraint(ScalarConstraint.lessThan(AffExpr.term(1.0d, f.x1()), 1.0d));
        edge.addConstraint(ScalarConstraint.lessThan(AffExpr.term(1.0d, f.y1()), 1.0d));
        edge.addConstraint(ScalarConstraint.equalTo(AffExpr.term(1.0d, f.x2()), 0.0d));

        ConstraintShape affineLe = ConstraintShape.of(FunctionShape.AFFINE, SetShape.LESS_THAN);
        ConstraintShape affineEq = ConstraintShape.of(FunctionShape.AFFINE, SetShape.EQUAL_TO);
        assertEquals(3, ConstraintIndexAllocator.nextIndex(edge.graphBackend(), edge, affineLe).getValue());
        assertEquals(2, ConstraintIndexAllocator.nextIndex(edge.graphBackend(), edge, affineEq).getValue());
        assertEquals(1, ConstraintIndexAllocator.nextIndex(edge.graphBackend(), edge,
                ConstraintShape.of(FunctionShape.QUADRATIC, SetShape.EQUAL_TO)).getValue());
    }

    @Test
    @DisplayName("Counters are scoped per element")
    void testPerElementCounters() {
        GraphFixtures.LinkingFixture f = GraphFixtures.linking();
        OptiEdge other = f.parent().addEdge("other", f.nodeA());
        f.link().addConstraint(ScalarConstraint.lessThan(AffExpr.term(1.0d, f.x1()), 1.0d));

        assertEquals(1, ConstraintIndexAllocator.numConstraints(
                f.parent().graphBackend(), f.link(), FunctionShape.AFFINE, SetShape.LESS_THAN));
        assertEquals(0, ConstraintIndexAllocator.numConstraints(
                f.parent().graphBackend(), other, FunctionShape.AFFINE, SetShape.LESS_THAN));
    }
}
