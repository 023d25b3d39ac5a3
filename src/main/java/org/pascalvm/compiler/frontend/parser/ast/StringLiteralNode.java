package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A string literal. Only valid as an argument of the output routines.
 *
 * @param value The literal text without the surrounding quotes.
 */
public record StringLiteralNode(String value) implements ExpressionNode {

    @Override
    public TypeCategory determinedType() {
        return TypeCategory.UNKNOWN;
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
