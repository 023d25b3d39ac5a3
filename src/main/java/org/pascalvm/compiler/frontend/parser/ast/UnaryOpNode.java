package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A prefix operator applied to one operand.
 *
 * @param operator       The operator token, see {@link UnaryOperator}.
 * @param operand        The operand.
 * @param determinedType The result type.
 */
public record UnaryOpNode(String operator, ExpressionNode operand, TypeCategory determinedType)
        implements ExpressionNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
