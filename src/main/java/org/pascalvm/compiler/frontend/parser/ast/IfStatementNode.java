package org.pascalvm.compiler.frontend.parser.ast;

/**
 * {@code if condition then thenStatement [else elseStatement]}.
 *
 * @param elseStatement The else branch, or {@code null}.
 */
public record IfStatementNode(
        ExpressionNode condition,
        StatementNode thenStatement,
        StatementNode elseStatement
) implements StatementNode {

    public IfStatementNode(ExpressionNode condition, StatementNode thenStatement) {
        this(condition, thenStatement, null);
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
