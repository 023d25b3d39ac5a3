package org.pascalvm.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * Prefix operators known to the code generator.
 */
public enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    NOT("not");

    private final String token;

    UnaryOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Looks up an operator by its source token, ignoring case.
     *
     * @param token The token as stored on the AST node.
     * @return The operator, or empty if the token is not a known prefix operator.
     */
    public static Optional<UnaryOperator> fromToken(String token) {
        String normalized = token.toLowerCase(Locale.ROOT);
        for (UnaryOperator op : values()) {
            if (op.token.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
