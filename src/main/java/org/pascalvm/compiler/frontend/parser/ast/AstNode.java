package org.pascalvm.compiler.frontend.parser.ast;

/**
 * Base of the typed abstract syntax tree handed to the code generator.
 * <p>
 * The hierarchy is closed: every concrete node is a record in this package, and every
 * node dispatches to exactly one method of {@link IAstVisitor}. Type denotations
 * ({@link TypeNode}) and subprogram heads ({@link SubprogramHead}) are plain data
 * carried by the nodes that declare them and are not visited on their own.
 */
public sealed interface AstNode permits ProgramNode, Declarations, VarDecl, SubprogramDeclarations,
        SubprogramDeclaration, ParameterDeclaration, StatementNode, ExpressionNode {

    /**
     * Dispatches this node to the matching {@code visit} method.
     * @param visitor The visitor.
     */
    void accept(IAstVisitor visitor);
}
