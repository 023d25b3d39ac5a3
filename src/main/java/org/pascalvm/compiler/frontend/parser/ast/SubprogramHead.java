package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolKind;

import java.util.List;

/**
 * Signature part of a subprogram declaration.
 */
public sealed interface SubprogramHead permits FunctionHeadNode, ProcedureHeadNode {

    String name();

    List<ParameterDeclaration> parameters();

    /**
     * @return {@link SymbolKind#FUNCTION} or {@link SymbolKind#PROCEDURE}.
     */
    SymbolKind kind();
}
