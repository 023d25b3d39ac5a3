package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolKind;

import java.util.List;

/**
 * {@code function name(parameters): returnType}.
 *
 * @param name       The declared name.
 * @param parameters The formal parameter groups in declaration order.
 * @param returnType The declared return type.
 */
public record FunctionHeadNode(String name, List<ParameterDeclaration> parameters, StandardTypeNode returnType)
        implements SubprogramHead {

    @Override
    public SymbolKind kind() {
        return SymbolKind.FUNCTION;
    }
}
