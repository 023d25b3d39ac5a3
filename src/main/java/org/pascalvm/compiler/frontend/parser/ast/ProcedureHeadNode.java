package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolKind;

import java.util.List;

/**
 * {@code procedure name(parameters)}.
 *
 * @param name       The declared name.
 * @param parameters The formal parameter groups in declaration order.
 */
public record ProcedureHeadNode(String name, List<ParameterDeclaration> parameters) implements SubprogramHead {

    @Override
    public SymbolKind kind() {
        return SymbolKind.PROCEDURE;
    }
}
