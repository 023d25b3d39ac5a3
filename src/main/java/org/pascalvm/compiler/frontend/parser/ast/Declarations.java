package org.pascalvm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code var} section: one or more declaration groups.
 *
 * @param varDecls The declaration groups in source order.
 */
public record Declarations(List<VarDecl> varDecls) implements AstNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
