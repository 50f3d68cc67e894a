package com.exprgraph.ast;

import java.math.BigDecimal;

/**
 * Renders an expression tree back to canonical infix text.
 *
 * <p>
 * Parentheses are emitted only where the tree shape requires them: around a
 * lower-precedence left operand, and around a right operand of equal or lower
 * precedence (operators are left-associative). Reparsing the output yields a
 * structurally equal tree.
 */
public final class ExpressionFormatter {
    private ExpressionFormatter() {
        // Utility class
    }

    public static String format(Expression expression) {
        StringBuilder sb = new StringBuilder(32);
        append(sb, expression);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Expression e) {
        if (e instanceof Val v) {
            appendNumber(sb, v.value());
        } else if (e instanceof Var v) {
            sb.append(v.name());
        } else if (e instanceof UnaryOp u) {
            sb.append(u.op().symbol());
            // the grammar only allows a primary after a sign
            appendGrouped(sb, u.operand(), !(u.operand() instanceof Val || u.operand() instanceof Var));
        } else if (e instanceof BinaryOp b) {
            appendGrouped(sb, b.left(), b.left() instanceof BinaryOp l && b.op().bindsTighterThan(l.op()));
            sb.append(' ').append(b.op().symbol()).append(' ');
            appendGrouped(sb, b.right(), b.right() instanceof BinaryOp r && !r.op().bindsTighterThan(b.op()));
        } else {
            throw new IllegalArgumentException("Unknown expression type: " + e.getClass().getName());
        }
    }

    private static void appendGrouped(StringBuilder sb, Expression e, boolean parens) {
        if (parens)
            sb.append('(');
        append(sb, e);
        if (parens)
            sb.append(')');
    }

    private static void appendNumber(StringBuilder sb, double value) {
        if (Double.isFinite(value))
            sb.append(BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
        else
            sb.append(value);
    }
}
