package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolKind;
import org.pascalvm.compiler.frontend.semantics.SymbolScope;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A bare identifier in expression position. When it names a function it denotes a call
 * without arguments.
 *
 * @param name           The identifier.
 * @param kind           What the identifier resolved to.
 * @param scope          Where the identifier was found.
 * @param determinedType The type of the value.
 */
public record IdExprNode(String name, SymbolKind kind, SymbolScope scope, TypeCategory determinedType)
        implements ExpressionNode {

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
