package com.exprgraph.ast;

import java.util.List;
import java.util.Set;

/**
 * A node in a parsed algebraic expression tree.
 *
 * Every expression is one of four shapes: a variable reference ({@link Var}),
 * a numeric literal ({@link Val}), a unary sign ({@link UnaryOp}) or a binary
 * arithmetic operation ({@link BinaryOp}). Each node exclusively owns its
 * children, so a tree is always finite, acyclic and never shared between two
 * parents.
 *
 * Immutability:
 * Trees are never edited in place. A new text edit produces a wholly new tree,
 * which lets the owning node keep its last valid tree while a new one is being
 * built and reconciled.
 *
 * Evaluation:
 * There is no error path. Variable lookups always succeed because the binding
 * list is derived from the very tree being evaluated, and arithmetic follows
 * IEEE-754 (division by zero yields an infinity or NaN).
 */
public interface Expression {

    /**
     * Computes the value of this expression.
     *
     * Nothing is cached; the caller may change {@code values} between two calls
     * and the next call sees the new inputs.
     *
     * @param bindings Ordered variable names, as derived from this tree.
     * @param values   Current value of each binding, positionally paired with
     *                 {@code bindings}.
     * @return The IEEE-754 result.
     */
    double evaluate(List<String> bindings, double[] values);

    /**
     * Adds every variable name of this subtree to {@code into} in pre-order,
     * left operand before right operand. Callers pass an insertion-ordered set
     * to obtain first-occurrence order.
     */
    void collectVariables(Set<String> into);
}
