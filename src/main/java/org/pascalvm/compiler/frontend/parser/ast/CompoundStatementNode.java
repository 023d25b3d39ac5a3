package org.pascalvm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code begin ... end}.
 */
public record CompoundStatementNode(List<StatementNode> statements) implements StatementNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
