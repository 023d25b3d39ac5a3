package org.pascalvm.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * Infix operators known to the code generator.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    REAL_DIVIDE("/"),
    INT_DIVIDE("div"),
    EQUAL("="),
    NOT_EQUAL("<>"),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    AND("and"),
    OR("or");

    private final String token;

    BinaryOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * @return True for {@code and} and {@code or}, which operate on the 0/1 boolean encoding.
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * Looks up an operator by its source token, ignoring case.
     *
     * @param token The token as stored on the AST node.
     * @return The operator, or empty if the token is not a known infix operator.
     */
    public static Optional<BinaryOperator> fromToken(String token) {
        String normalized = token.toLowerCase(Locale.ROOT);
        for (BinaryOperator op : values()) {
            if (op.token.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
