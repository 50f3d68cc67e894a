package com.exprgraph.ast;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Stack-based traversals of expression trees. Tree depth is bounded only by
 * heap, not by the thread's call stack.
 */
final class TreeWalk {
    private TreeWalk() {
        // Utility class
    }

    /** A node still to visit; {@code expanded} once its children are queued. */
    private record Frame(Expression node, boolean expanded) {
    }

    static double evaluate(Expression root, List<String> bindings, double[] values) {
        Deque<Frame> work = new ArrayDeque<>();
        double[] operands = new double[16];
        int sp = 0;

        work.push(new Frame(root, false));
        while (!work.isEmpty()) {
            Frame f = work.pop();
            Expression e = f.node();
            if (e instanceof BinaryOp b) {
                if (f.expanded()) {
                    double right = operands[--sp];
                    double left = operands[--sp];
                    operands[sp++] = b.op().apply(left, right);
                } else {
                    work.push(new Frame(b, true));
                    work.push(new Frame(b.right(), false));
                    work.push(new Frame(b.left(), false));
                }
            } else if (e instanceof UnaryOp u) {
                if (f.expanded()) {
                    operands[sp - 1] = u.op().apply(operands[sp - 1]);
                } else {
                    work.push(new Frame(u, true));
                    work.push(new Frame(u.operand(), false));
                }
            } else {
                if (sp == operands.length)
                    operands = Arrays.copyOf(operands, sp * 2);
                operands[sp++] = e.evaluate(bindings, values);
            }
        }
        return operands[0];
    }

    static void collectVariables(Expression root, Set<String> into) {
        Deque<Expression> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Expression e = work.pop();
            if (e instanceof BinaryOp b) {
                work.push(b.right());
                work.push(b.left());
            } else if (e instanceof UnaryOp u) {
                work.push(u.operand());
            } else {
                e.collectVariables(into);
            }
        }
    }
}
