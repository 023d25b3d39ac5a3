package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolEntry;

/**
 * A function or procedure definition.
 *
 * @param head              The signature.
 * @param localDeclarations The local variable declarations, or {@code null}.
 * @param body              The statement block.
 * @param resolvedEntry     The entry registered for this definition by semantic analysis, or
 *                          {@code null} when the generator has to locate it by its mangled name.
 */
public record SubprogramDeclaration(
        SubprogramHead head,
        Declarations localDeclarations,
        CompoundStatementNode body,
        SymbolEntry resolvedEntry
) implements AstNode {

    /**
     * Creates a definition without a pre-resolved entry.
     */
    public SubprogramDeclaration(SubprogramHead head, Declarations localDeclarations, CompoundStatementNode body) {
        this(head, localDeclarations, body, null);
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
