package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * {@code true} or {@code false}.
 */
public record BooleanLiteralNode(boolean value) implements ExpressionNode {

    @Override
    public TypeCategory determinedType() {
        return TypeCategory.BOOLEAN;
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
