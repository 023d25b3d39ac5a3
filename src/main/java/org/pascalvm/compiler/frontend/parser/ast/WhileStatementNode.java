package org.pascalvm.compiler.frontend.parser.ast;

/**
 * {@code while condition do body}.
 */
public record WhileStatementNode(ExpressionNode condition, StatementNode body) implements StatementNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
