package org.pascalvm.compiler.frontend.parser.ast;

/**
 * {@code return [value]}.
 *
 * @param returnValue The returned expression, or {@code null} for a bare return.
 */
public record ReturnStatementNode(ExpressionNode returnValue) implements StatementNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
