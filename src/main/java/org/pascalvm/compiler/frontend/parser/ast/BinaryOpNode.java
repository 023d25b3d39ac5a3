package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * An infix operator applied to two operands.
 *
 * @param operator       The operator token, see {@link BinaryOperator}.
 * @param left           The left operand.
 * @param right          The right operand.
 * @param determinedType The result type.
 */
public record BinaryOpNode(String operator, ExpressionNode left, ExpressionNode right, TypeCategory determinedType)
        implements ExpressionNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
