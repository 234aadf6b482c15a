package org.optigraph.registration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.optigraph.backend.GraphBackend;
import org.optigraph.backend.InMemoryModelStore;
import org.optigraph.backend.MissingVariableException;
import org.optigraph.backend.ModelStore;
import org.optigraph.backend.ModelStoreConfig;
import org.optigraph.backend.UnsupportedShapeException;
import org.optigraph.backend.VariableIndex;
import org.optigraph.graph.NodeVariableRef;
import org.optigraph.graph.OptiEdge;
import org.optigraph.graph.OptiGraph;
import org.optigraph.graph.OptiNode;
import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintRef;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.FunctionShape;
import org.optigraph.model.constraint.ScalarConstraint;
import org.optigraph.model.expr.AffExpr;
import org.optigraph.model.expr.NonlinearExpr;
import org.optigraph.model.expr.QuadExpr;
import org.optigraph.model.expr.VariableExpr;
import org.optigraph.model.set.Interval;
import org.optigraph.model.set.LessThan;
import org.optigraph.model.set.SetShape;
import org.optigraph.testutil.GraphFixtures;
import org.optigraph.testutil.GraphFixtures.LinkingFixture;
import org.optigraph.testutil.GraphFixtures.MirrorFixture;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EdgeConstraintRegistrar Tests")
class EdgeConstraintRegistrarTest {

    private static final ConstraintShape AFFINE_LE = ConstraintShape.of(FunctionShape.AFFINE, SetShape.LESS_THAN);

    /**
     * Accepts every shape but fails when a constraint is written.
     */
    private static final class FailingModelStore implements ModelStore {
        private final InMemoryModelStore delegate = new InMemoryModelStore();

        @Override
        public String name() {
            return "failing";
        }

        @Override
        public VariableIndex addVariable() {
            return delegate.addVariable();
        }

        @Override
        public int numVariables() {
            return delegate.numVariables();
        }

        @Override
        public boolean isValid(VariableIndex variable) {
            return delegate.isValid(variable);
        }

        @Override
        public boolean supportsConstraint(ConstraintShape shape) {
            return true;
        }

        @Override
        public int numConstraints(ConstraintShape shape) {
            return delegate.numConstraints(shape);
        }

        @Override
        public void addConstraint(ConstraintIndex index, CanonicalConstraint<VariableIndex> constraint) {
            throw new IllegalStateException("store write failed");
        }

        @Override
        public boolean isValid(ConstraintIndex index) {
            return delegate.isValid(index);
        }

        @Override
        public CanonicalConstraint<VariableIndex> constraint(ConstraintIndex index) {
            return delegate.constraint(index);
        }

        @Override
        public void setConstraintName(ConstraintIndex index, String name) {
            delegate.setConstraintName(index, name);
        }

        @Override
        public String constraintName(ConstraintIndex index) {
            return delegate.constraintName(index);
        }

        @Override
        public List<ConstraintShape> constraintShapes() {
            return delegate.constraintShapes();
        }
    }

    private static AffExpr<NodeVariableRef> sum(NodeVariableRef a, NodeVariableRef b) {
        return AffExpr.<NodeVariableRef>builder().addTerm(1.0d, a).addTerm(1.0d, b).build();
    }

    private static QuadExpr<NodeVariableRef> product(NodeVariableRef a, NodeVariableRef b) {
        return QuadExpr.<NodeVariableRef>builder().addQuadTerm(1.0d, a, b).build();
    }

    @Test
    @DisplayName("Linking constraint registers foreign variables in the parent backend only")
    void testLinkingAcrossSubgraphs() {
        LinkingFixture f = GraphFixtures.linking();
        GraphBackend z = f.parent().graphBackend();
        assertFalse(z.hasVariable(f.x1()));

        ConstraintRef ref = f.link().addConstraint(ScalarConstraint.lessThan(sum(f.x1(), f.y1()), 1.0d), "cap");

        assertEquals(new ConstraintIndex(AFFINE_LE, 1), ref.getIndex());
        assertTrue(z.hasVariable(f.x1()));
        assertTrue(z.hasVariable(f.y1()));
        assertFalse(z.hasVariable(f.x2()));
        assertEquals(2, z.numVariables());
        assertEquals(2, f.subgraphX().graphBackend().numVariables());
        assertEquals(1, f.subgraphY().graphBackend().numVariables());
        assertEquals(0, f.subgraphX().graphBackend().numConstraints());

        CanonicalConstraint<VariableIndex> local = z.localConstraint(ref);
        assertEquals(AffExpr.<VariableIndex>builder()
                .addTerm(1.0d, new VariableIndex(1))
                .addTerm(1.0d, new VariableIndex(2))
                .build(), local.getFunction());
        assertEquals("cap", f.link().constraintName(ref));
    }

    @Test
    @DisplayName("Indices are dense 1..N per shape on one edge")
    void testDenseIndices() {
        LinkingFixture f = GraphFixtures.linking();
        OptiEdge link = f.link();

        ConstraintRef first = link.addConstraint(ScalarConstraint.lessThan(sum(f.x1(), f.y1()), 1.0d));
        ConstraintRef eq = link.addConstraint(ScalarConstraint.equalTo(sum(f.x2(), f.y1()), 0.0d));
        ConstraintRef second = link.addConstraint(ScalarConstraint.lessThan(sum(f.x2(), f.y1()), 2.0d));
        ConstraintRef third = link.addConstraint(ScalarConstraint.lessThan(AffExpr.term(3.0d, f.x1()), 4.0d));

        assertEquals(List.of(1, 2, 3), List.of(
                first.getIndex().getValue(), second.getIndex().getValue(), third.getIndex().getValue()));
        assertEquals(1, eq.getIndex().getValue());
        assertEquals(List.of(first, second, third), link.listConstraints(FunctionShape.AFFINE, SetShape.LESS_THAN));
        assertEquals(List.of(first, eq, second, third), link.allConstraints());
        assertEquals(3, link.numConstraints(FunctionShape.AFFINE, SetShape.LESS_THAN));
    }

    @Test
    @DisplayName("Reverse maps round-trip between references and local indices")
    void testRoundTrip() {
        LinkingFixture f = GraphFixtures.linking();
        GraphBackend z = f.parent().graphBackend();
        ConstraintRef ref = f.link().addConstraint(ScalarConstraint.greaterThan(AffExpr.term(2.0d, f.y1()), 1.0d));

        assertSame(ref, z.constraintRef(z.localIndex(ref)));
        assertEquals(AffExpr.term(2.0d, f.y1()), z.graphConstraint(ref).getFunction());
        assertEquals(List.of(f.y1()), f.link().allVariables());
    }

    @Test
    @DisplayName("Mirrored edge is stored in every containing backend under its own local index")
    void testMirroredStorage() {
        MirrorFixture f = GraphFixtures.mirrored();
        OptiNode q = f.parent().addNode("q");
        NodeVariableRef v = q.addVariable("v");
        f.parent().addEdge("pe", q).addConstraint(ScalarConstraint.lessThan(AffExpr.term(1.0d, v), 1.0d));

        ConstraintRef ref = f.edge().addConstraint(ScalarConstraint.lessThan(sum(f.u(), f.w()), 5.0d), "m");

        GraphBackend s = f.subgraph().graphBackend();
        GraphBackend p = f.parent().graphBackend();
        assertEquals(List.of(f.subgraph(), f.parent()), f.edge().containingGraphs());
        assertEquals(1, ref.getIndex().getValue());
        assertEquals(1, s.localIndex(ref).getValue());
        assertEquals(2, p.localIndex(ref).getValue());
        assertEquals(s.graphConstraint(ref), p.graphConstraint(ref));
        assertTrue(p.hasVariable(f.u()));
        assertTrue(p.hasVariable(f.w()));
        assertEquals("m", p.constraintName(ref));
        assertEquals(1, p.numConstraints(f.edge(), AFFINE_LE));
    }

    @Test
    @DisplayName("Validate-then-commit leaves every backend untouched on unsupported shape")
    void testValidateThenCommitRejectsUpFront() {
        MirrorFixture f = GraphFixtures.mirrored(ModelStoreConfig.linearOnly(), RegistrationConfig.validateThenCommit());

        assertThrows(UnsupportedShapeException.class,
                () -> f.edge().addConstraint(ScalarConstraint.lessThan(product(f.u(), f.w()), 1.0d)));

        assertEquals(0, f.subgraph().graphBackend().numConstraints());
        assertEquals(0, f.parent().graphBackend().numConstraints());
        assertFalse(f.parent().graphBackend().hasVariable(f.u()));
        assertTrue(f.edge().allConstraints().isEmpty());
    }

    @Test
    @DisplayName("Best-effort reports the graphs updated before the failure")
    void testBestEffortPartialFailure() {
        MirrorFixture f = GraphFixtures.mirrored(ModelStoreConfig.linearOnly(), RegistrationConfig.bestEffort());

        PartialRegistrationException ex = assertThrows(PartialRegistrationException.class,
                () -> f.edge().addConstraint(ScalarConstraint.lessThan(product(f.u(), f.w()), 1.0d)));

        assertEquals(PartialRegistrationException.REASON_PARTIAL_REGISTRATION, ex.reasonCode());
        assertEquals(List.of(f.subgraph()), ex.succeededGraphs());
        assertSame(f.parent(), ex.failedGraph());
        assertTrue(ex.getCause() instanceof UnsupportedShapeException);
        assertTrue(f.subgraph().graphBackend().hasConstraint(ex.constraintRef()));
        assertFalse(f.parent().graphBackend().hasConstraint(ex.constraintRef()));
        assertFalse(f.parent().graphBackend().hasVariable(f.u()));
    }

    @Test
    @DisplayName("Store fault during commit reports the graphs already updated")
    void testValidateThenCommitStoreFault() {
        MirrorFixture f = GraphFixtures.mirrored(new FailingModelStore(), RegistrationConfig.validateThenCommit());

        PartialRegistrationException ex = assertThrows(PartialRegistrationException.class,
                () -> f.edge().addConstraint(ScalarConstraint.lessThan(sum(f.u(), f.w()), 1.0d)));

        assertEquals(List.of(f.subgraph()), ex.succeededGraphs());
        assertSame(f.parent(), ex.failedGraph());
        assertTrue(ex.getCause() instanceof IllegalStateException);
        assertTrue(f.subgraph().graphBackend().hasConstraint(ex.constraintRef()));
        assertEquals(ex.constraintRef(), f.edge().allConstraints().get(0));
    }

    @Test
    @DisplayName("Best-effort shape rejection in the primary backend registers no variables")
    void testBestEffortPrimaryRejection() {
        OptiGraph root = new OptiGraph("root", new InMemoryModelStore(ModelStoreConfig.linearOnly()),
                RegistrationConfig.bestEffort());
        OptiGraph sub = root.addSubgraph("sub");
        OptiNode n = sub.addNode("n");
        NodeVariableRef x = n.addVariable("x");
        OptiEdge edge = root.addEdge("e", n);

        assertThrows(UnsupportedShapeException.class,
                () -> edge.addConstraint(ScalarConstraint.lessThan(product(x, x), 1.0d)));

        assertEquals(0, root.graphBackend().numVariables());
        assertEquals(0, root.graphBackend().numConstraints());
    }

    @Test
    @DisplayName("Interval constraint is stored with both bounds shifted by the constant")
    void testIntervalConstraint() {
        LinkingFixture f = GraphFixtures.linking();
        AffExpr<NodeVariableRef> fn = AffExpr.<NodeVariableRef>builder()
                .addTerm(1.0d, f.x1())
                .addTerm(-1.0d, f.y1())
                .constant(1.0d)
                .build();

        ConstraintRef ref = f.link().addConstraint(ScalarConstraint.interval(fn, 0.0d, 2.0d), "band");

        assertEquals(ConstraintShape.of(FunctionShape.AFFINE, SetShape.INTERVAL), ref.shape());
        assertEquals(new Interval(-1.0d, 1.0d), f.link().constraintSet(ref));
        assertEquals(List.of(ref), f.link().listConstraints(FunctionShape.AFFINE, SetShape.INTERVAL));
        assertEquals("band", f.link().constraintName(ref));
    }

    @ParameterizedTest
    @EnumSource(RegistrationPolicy.class)
    @DisplayName("Unresolvable variable handle fails before anything is stored")
    void testMissingVariable(RegistrationPolicy policy) {
        MirrorFixture f = GraphFixtures.mirrored(ModelStoreConfig.allShapes(),
                RegistrationConfig.builder().policy(policy).build());
        NodeVariableRef foreign = new NodeVariableRef(f.node1(), 99);

        MissingVariableException ex = assertThrows(MissingVariableException.class,
                () -> f.edge().addConstraint(ScalarConstraint.lessThan(sum(f.u(), foreign), 1.0d)));

        assertEquals(MissingVariableException.REASON_MISSING_VARIABLE, ex.reasonCode());
        assertEquals(0, f.subgraph().graphBackend().numConstraints());
        assertEquals(0, f.parent().graphBackend().numConstraints());
    }

    @Test
    @DisplayName("Constant terms end up in the stored set")
    void testConstantFoldedIntoSet() {
        LinkingFixture f = GraphFixtures.linking();
        AffExpr<NodeVariableRef> fn = AffExpr.<NodeVariableRef>builder().addTerm(1.0d, f.x1()).constant(2.0d).build();

        ConstraintRef ref = f.link().addConstraint(ScalarConstraint.lessThan(fn, 5.0d));

        assertEquals(new LessThan(3.0d), f.link().constraintSet(ref));
        assertEquals(AffExpr.term(1.0d, f.x1()), f.link().constraintFunction(ref));
    }

    @Test
    @DisplayName("Nonlinear constraint registers every leaf variable and lists its type")
    void testNonlinearConstraint() {
        LinkingFixture f = GraphFixtures.linking();
        NonlinearExpr<NodeVariableRef> fn = NonlinearExpr.of("log", sum(f.x2(), f.y1()), VariableExpr.of(f.x1()));

        ConstraintRef ref = f.link().addConstraint(ScalarConstraint.lessThan(fn, 0.0d));

        assertEquals(ConstraintShape.of(FunctionShape.NONLINEAR, SetShape.LESS_THAN), ref.shape());
        assertEquals(3, f.parent().graphBackend().numVariables());
        assertEquals(List.of(f.x2(), f.y1(), f.x1()), f.link().allVariables());
        assertEquals(List.of(ref.shape()), f.link().listConstraintTypes());
    }

    @Test
    @DisplayName("Shape types are listed in first-use order")
    void testListConstraintTypes() {
        LinkingFixture f = GraphFixtures.linking();
        f.link().addConstraint(ScalarConstraint.equalTo(sum(f.x1(), f.y1()), 0.0d));
        f.link().addConstraint(ScalarConstraint.lessThan(product(f.x1(), f.y1()), 1.0d));
        f.link().addConstraint(ScalarConstraint.equalTo(sum(f.x2(), f.y1()), 0.0d));

        assertEquals(List.of(
                ConstraintShape.of(FunctionShape.AFFINE, SetShape.EQUAL_TO),
                ConstraintShape.of(FunctionShape.QUADRATIC, SetShape.LESS_THAN)), f.link().listConstraintTypes());
        assertEquals(List.of(f.x1(), f.y1(), f.x2()), f.link().allVariables());
    }

    @Test
    @DisplayName("Flattened sub-graph edge lands in the shared backend")
    void testFlattenedSubgraph() {
        OptiGraph root = new OptiGraph("root");
        OptiGraph flat = root.addFlattenedSubgraph("flat");
        OptiNode n = flat.addNode("n");
        NodeVariableRef x = n.addVariable("x");
        OptiEdge edge = flat.addEdge("e", n);

        ConstraintRef ref = edge.addConstraint(ScalarConstraint.lessThan(AffExpr.term(1.0d, x), 1.0d));

        assertEquals(List.of(root), edge.containingGraphs());
        assertTrue(root.graphBackend().hasConstraint(ref));
        assertEquals(1, root.graphBackend().numVariables());
    }
}
