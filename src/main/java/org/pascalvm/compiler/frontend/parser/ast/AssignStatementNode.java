package org.pascalvm.compiler.frontend.parser.ast;

/**
 * {@code target := expression}.
 *
 * @param target     The assigned variable, possibly an indexed array element.
 * @param expression The value.
 */
public record AssignStatementNode(VariableNode target, ExpressionNode expression) implements StatementNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
