package com.exprgraph.parse;

import java.util.List;
import java.util.Objects;

import com.exprgraph.ast.BinaryOp;
import com.exprgraph.ast.BinaryOperator;
import com.exprgraph.ast.Expression;
import com.exprgraph.ast.UnaryOp;
import com.exprgraph.ast.UnaryOperator;
import com.exprgraph.ast.Val;
import com.exprgraph.ast.Var;

/**
 * Recursive-descent parser for algebraic expressions.
 *
 * <p>
 * Grammar:
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := factor (('*' | '/') factor)*
 * factor  := unary | primary
 * unary   := ('+' | '-') primary
 * primary := NUMBER | IDENT | '(' expr ')'
 * </pre>
 *
 * <p>
 * The two tiers are handled by precedence climbing rather than one method per
 * tier: an operand is parsed, then {@code (operator, operand)} pairs are
 * consumed. When the operator after an operand binds tighter than the one just
 * consumed, the parser recurses to absorb the tighter subexpression first;
 * otherwise it folds left to right. So {@code 2+3*4} is {@code 2+(3*4)} and
 * {@code 2-3-4} is {@code (2-3)-4}.
 *
 * <p>
 * The whole input must be consumed. Failures throw
 * {@link ExpressionParseException} and never produce a partial tree.
 *
 * <p>
 * Input longer than {@link #MAX_TEXT_LENGTH} characters, or with parentheses
 * nested deeper than {@link #MAX_NESTING}, is rejected as
 * {@link ParseErrorKind#UNEXPECTED_TOKEN}.
 */
public final class ExpressionParser {
    public static final int MAX_TEXT_LENGTH = 4096;
    public static final int MAX_NESTING = 256;

    private ExpressionParser() {
        // Utility class
    }

    /**
     * Parses a complete expression.
     *
     * @throws ExpressionParseException if the text is empty or malformed.
     */
    public static Expression parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() > MAX_TEXT_LENGTH)
            throw new ExpressionParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                    "Expression longer than " + MAX_TEXT_LENGTH + " characters", MAX_TEXT_LENGTH);
        return new Cursor(Lexer.tokenize(text)).parseAll();
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;
        private int depth;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expression parseAll() {
            if (peek().is(TokenType.END))
                throw err(ParseErrorKind.EMPTY_INPUT, "Empty expression", peek());
            Expression e = parseExpression();
            Token t = peek();
            if (!t.is(TokenType.END))
                throw err(ParseErrorKind.TRAILING_INPUT, "Unexpected trailing input " + t.describe(), t);
            return e;
        }

        private Expression parseExpression() {
            return foldBinary(parseOperand(), 0);
        }

        private Expression foldBinary(Expression lhs, int minPrecedence) {
            BinaryOperator op;
            while ((op = peekBinary()) != null && op.precedence() >= minPrecedence) {
                pos++;
                Expression rhs = parseOperand();
                BinaryOperator following;
                while ((following = peekBinary()) != null && following.bindsTighterThan(op))
                    rhs = foldBinary(rhs, following.precedence());
                lhs = new BinaryOp(op, lhs, rhs);
            }
            return lhs;
        }

        /** factor := unary | primary */
        private Expression parseOperand() {
            Token t = peek();
            if (t.is(TokenType.PLUS) || t.is(TokenType.MINUS)) {
                pos++;
                UnaryOperator op = t.is(TokenType.PLUS) ? UnaryOperator.POS : UnaryOperator.NEG;
                return new UnaryOp(op, parsePrimary());
            }
            return parsePrimary();
        }

        private Expression parsePrimary() {
            Token t = peek();
            switch (t.type()) {
                case NUMBER -> {
                    pos++;
                    return new Val(Double.parseDouble(t.text()));
                }
                case IDENT -> {
                    pos++;
                    return new Var(t.text());
                }
                case LPAREN -> {
                    if (depth == MAX_NESTING)
                        throw err(ParseErrorKind.UNEXPECTED_TOKEN,
                                "Parentheses nested deeper than " + MAX_NESTING, t);
                    pos++;
                    depth++;
                    Expression inner = parseExpression();
                    depth--;
                    Token close = peek();
                    if (close.is(TokenType.RPAREN)) {
                        pos++;
                        return inner;
                    }
                    if (close.is(TokenType.END))
                        throw err(ParseErrorKind.UNCLOSED_PAREN, "Unclosed '('", t);
                    throw err(ParseErrorKind.UNEXPECTED_TOKEN, "Expected ')' but found " + close.describe(), close);
                }
                default -> throw err(ParseErrorKind.UNEXPECTED_TOKEN, "Unexpected " + t.describe(), t);
            }
        }

        private BinaryOperator peekBinary() {
            return switch (peek().type()) {
                case PLUS -> BinaryOperator.ADD;
                case MINUS -> BinaryOperator.SUB;
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                default -> null;
            };
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private static ExpressionParseException err(ParseErrorKind kind, String msg, Token at) {
            return new ExpressionParseException(kind, msg, at.position());
        }
    }
}
