package com.exprgraph.ast;

import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ExpressionTest {

    private static final List<String> NO_BINDINGS = List.of();
    private static final double[] NO_VALUES = new double[0];

    @Test
    public void testLiteral() {
        assertEquals(4.5, new Val(4.5).evaluate(NO_BINDINGS, NO_VALUES), 0.0);
    }

    @Test
    public void testVariableReadsPositionalValue() {
        Expression e = new BinaryOp(BinaryOperator.SUB, new Var("b"), new Var("a"));
        assertEquals(7.0, e.evaluate(List.of("b", "a"), new double[] { 10.0, 3.0 }), 0.0);
    }

    @Test
    public void testValuesAreReadOnEveryCall() {
        Expression e = new BinaryOp(BinaryOperator.MUL, new Var("x"), new Val(2));
        double[] values = { 1.0 };
        assertEquals(2.0, e.evaluate(List.of("x"), values), 0.0);
        values[0] = 21.0;
        assertEquals(42.0, e.evaluate(List.of("x"), values), 0.0);
    }

    @Test
    public void testUnary() {
        assertEquals(-3.0, new UnaryOp(UnaryOperator.NEG, new Val(3)).evaluate(NO_BINDINGS, NO_VALUES), 0.0);
        assertEquals(3.0, new UnaryOp(UnaryOperator.POS, new Val(3)).evaluate(NO_BINDINGS, NO_VALUES), 0.0);
    }

    @Test
    public void testDivisionByZeroFollowsIeee754() {
        Expression posInf = new BinaryOp(BinaryOperator.DIV, new Val(1), new Val(0));
        Expression negInf = new BinaryOp(BinaryOperator.DIV, new UnaryOp(UnaryOperator.NEG, new Val(1)), new Val(0));
        Expression nan = new BinaryOp(BinaryOperator.DIV, new Val(0), new Val(0));

        assertEquals(Double.POSITIVE_INFINITY, posInf.evaluate(NO_BINDINGS, NO_VALUES), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, negInf.evaluate(NO_BINDINGS, NO_VALUES), 0.0);
        assertTrue(Double.isNaN(nan.evaluate(NO_BINDINGS, NO_VALUES)));
    }

    @Test
    public void testTreesCompareStructurally() {
        Expression a = new BinaryOp(BinaryOperator.ADD, new Var("x"), new Val(1));
        Expression b = new BinaryOp(BinaryOperator.ADD, new Var("x"), new Val(1));
        assertEquals(a, b);
        assertNotEquals(a, new BinaryOp(BinaryOperator.ADD, new Val(1), new Var("x")));
    }

    @Test(expected = NullPointerException.class)
    public void testBinaryRejectsMissingOperand() {
        new BinaryOp(BinaryOperator.ADD, new Val(1), null);
    }

    @Test
    public void testOperatorTiers() {
        assertTrue(BinaryOperator.MUL.bindsTighterThan(BinaryOperator.ADD));
        assertTrue(BinaryOperator.DIV.bindsTighterThan(BinaryOperator.SUB));
        assertFalse(BinaryOperator.ADD.bindsTighterThan(BinaryOperator.SUB));
        assertFalse(BinaryOperator.MUL.bindsTighterThan(BinaryOperator.DIV));
    }

    @Test
    public void testDeepTreesDoNotExhaustStack() {
        Expression left = new Var("x");
        for (int i = 0; i < 100_000; i++)
            left = new BinaryOp(BinaryOperator.ADD, left, new UnaryOp(UnaryOperator.NEG, new Val(1)));
        assertEquals(-99_995.0, left.evaluate(List.of("x"), new double[] { 5.0 }), 0.0);

        Expression right = new Var("y");
        for (int i = 0; i < 100_000; i++)
            right = new BinaryOp(BinaryOperator.MUL, new Var("k" + (i % 2)), right);
        Set<String> names = new LinkedHashSet<>();
        right.collectVariables(names);
        assertEquals(List.of("k1", "k0", "y"), new ArrayList<>(names));
        assertEquals(3.0, right.evaluate(List.of("k1", "k0", "y"), new double[] { 1.0, 1.0, 3.0 }), 0.0);
    }
}
