package org.pascalvm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A formal parameter group, e.g. {@code a, b: real}.
 *
 * @param identifiers The parameter names in declaration order.
 * @param type        The type shared by the group.
 */
public record ParameterDeclaration(List<String> identifiers, TypeNode type) implements AstNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
