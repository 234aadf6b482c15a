package org.optigraph.model.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Expression Model Tests")
class ExpressionModelTest {

    @Test
    @DisplayName("AffExpr builder accumulates coefficients of repeated variables")
    void testAffineAccumulation() {
        AffExpr<String> aff = AffExpr.<String>builder()
                .addTerm(2.0d, "x")
                .addTerm(0.5d, "x")
                .addConstant(1.0d)
                .addConstant(2.0d)
                .build();

        assertEquals(1, aff.numTerms());
        assertEquals(2.5d, aff.coefficient("x"), 1e-12);
        assertEquals(0.0d, aff.coefficient("missing"), 1e-12);
        assertEquals(3.0d, aff.constant(), 1e-12);
    }

    @Test
    @DisplayName("AffExpr terms view is read-only")
    void testAffineTermsReadOnly() {
        AffExpr<String> aff = AffExpr.term(1.0d, "x");
        assertThrows(UnsupportedOperationException.class, () -> aff.terms().put("y", 1.0d));
    }

    @Test
    @DisplayName("mapVariables rewrites every variable and keeps structure")
    void testMapVariables() {
        Map<String, Integer> slots = Map.of("x", 1, "y", 2);
        QuadExpr<String> quad = QuadExpr.<String>builder()
                .addQuadTerm(3.0d, "x", "y")
                .addTerm(4.0d, "y")
                .constant(1.0d)
                .build();

        QuadExpr<Integer> mapped = quad.mapVariables(slots::get);

        assertEquals(List.of(new QuadTerm<>(3.0d, 1, 2)), mapped.getTerms());
        assertEquals(4.0d, mapped.getAff().coefficient(2), 1e-12);
        assertEquals(1.0d, mapped.getAff().constant(), 1e-12);
        assertEquals(quad, mapped.mapVariables(i -> i == 1 ? "x" : "y"));
    }

    @Test
    @DisplayName("Nonlinear mapVariables reaches nested children of every kind")
    void testNonlinearMapVariables() {
        NonlinearExpr<String> expr = NonlinearExpr.of("exp",
                NonlinearExpr.of("*", Constant.of(2.0d), VariableExpr.of("x")),
                AffExpr.term(1.0d, "y"));

        NonlinearExpr<String> renamed = expr.mapVariables(v -> v + "'");

        assertEquals("exp(*(2.0, x'), 1.0*y')", renamed.toString());
    }

    @Test
    @DisplayName("Equality is structural")
    void testStructuralEquality() {
        assertEquals(AffExpr.term(1.0d, "x"), AffExpr.term(1.0d, "x"));
        assertNotEquals(AffExpr.term(1.0d, "x"), AffExpr.term(2.0d, "x"));
        assertEquals(NonlinearExpr.of("sin", VariableExpr.of("x")), NonlinearExpr.of("sin", VariableExpr.of("x")));
    }

    @Test
    @DisplayName("Nonlinear head must be non-blank")
    void testBlankHeadRejected() {
        assertThrows(IllegalArgumentException.class, () -> NonlinearExpr.of(" ", VariableExpr.of("x")));
    }
}
