package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * An integer literal.
 */
public record IntNumNode(int value) implements ExpressionNode {

    @Override
    public TypeCategory determinedType() {
        return TypeCategory.INTEGER;
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
