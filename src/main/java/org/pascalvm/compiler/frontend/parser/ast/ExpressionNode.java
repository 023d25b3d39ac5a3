package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * An expression whose type has been determined by semantic analysis.
 */
public sealed interface ExpressionNode extends AstNode permits VariableNode, IdExprNode, FunctionCallExprNode,
        IntNumNode, RealNumNode, BooleanLiteralNode, StringLiteralNode, UnaryOpNode, BinaryOpNode {

    /**
     * @return The type category assigned to this expression during semantic analysis.
     */
    TypeCategory determinedType();
}
