package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolEntry;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

import java.util.List;

/**
 * A function call with arguments in expression position.
 *
 * @param funcName       The called name as written.
 * @param arguments      The actual arguments in source order.
 * @param resolvedEntry  The overload chosen by semantic analysis, or {@code null} if resolution failed.
 * @param determinedType The return type.
 */
public record FunctionCallExprNode(
        String funcName,
        List<ExpressionNode> arguments,
        SymbolEntry resolvedEntry,
        TypeCategory determinedType
) implements ExpressionNode {

    /**
     * A missing argument list is treated as empty.
     */
    public FunctionCallExprNode {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
