package org.pascalvm.compiler.frontend.parser.ast;

/**
 * Root of a compilation unit.
 *
 * @param name         The program name.
 * @param declarations The global variable declarations, or {@code null} if there are none.
 * @param subprograms  The subprogram definitions, or {@code null} if there are none.
 * @param mainBlock    The main statement block.
 */
public record ProgramNode(
        String name,
        Declarations declarations,
        SubprogramDeclarations subprograms,
        CompoundStatementNode mainBlock
) implements AstNode {

    /**
     * @return True if at least one subprogram is defined.
     */
    public boolean hasSubprograms() {
        return subprograms != null && !subprograms.subprograms().isEmpty();
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
