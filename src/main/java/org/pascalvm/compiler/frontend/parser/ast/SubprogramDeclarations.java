package org.pascalvm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * All subprogram definitions of a program, in source order.
 */
public record SubprogramDeclarations(List<SubprogramDeclaration> subprograms) implements AstNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
