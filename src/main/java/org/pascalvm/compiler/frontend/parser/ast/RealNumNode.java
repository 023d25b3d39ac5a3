package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A real literal.
 */
public record RealNumNode(double value) implements ExpressionNode {

    @Override
    public TypeCategory determinedType() {
        return TypeCategory.REAL;
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
