package org.optigraph.model.expr;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Operator node of a nonlinear expression tree, for example {@code sin(x)} or
 * {@code x * exp(y)}.
 * <p>
 * Children may be of any {@link ExpressionKind}, including further nonlinear nodes.
 */
@Value
public class NonlinearExpr<V> implements ScalarExpression<V> {
    String head;
    List<ScalarExpression<V>> args;

    public NonlinearExpr(String head, List<? extends ScalarExpression<V>> args) {
        String normalized = Objects.requireNonNull(head, "head").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("head must be non-blank");
        }
        this.head = normalized;
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    @SafeVarargs
    public static <V> NonlinearExpr<V> of(String head, ScalarExpression<V>... args) {
        return new NonlinearExpr<>(head, Arrays.asList(args));
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.NONLINEAR;
    }

    @Override
    public <W> NonlinearExpr<W> mapVariables(Function<? super V, ? extends W> mapper) {
        List<ScalarExpression<W>> mapped = new ArrayList<>(args.size());
        for (ScalarExpression<V> arg : args) {
            mapped.add(arg.mapVariables(mapper));
        }
        return new NonlinearExpr<>(head, mapped);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(head).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
