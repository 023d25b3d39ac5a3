package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolScope;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A reference to a variable, optionally indexed: {@code x} or {@code a[i]}.
 * Used both as an assignment target and as an expression.
 *
 * @param name           The variable name.
 * @param index          The index expression for array elements, or {@code null}.
 * @param scope          Where semantic analysis found the variable.
 * @param determinedType The type of the referenced value (the element type for indexed references).
 */
public record VariableNode(
        String name,
        ExpressionNode index,
        SymbolScope scope,
        TypeCategory determinedType
) implements ExpressionNode {

    public boolean isIndexed() {
        return index != null;
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
