package org.pascalvm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One declaration group, e.g. {@code x, y: integer}.
 *
 * @param identifiers The declared names in source order.
 * @param type        The declared type shared by all names.
 */
public record VarDecl(List<String> identifiers, TypeNode type) implements AstNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
