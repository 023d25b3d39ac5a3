package org.pascalvm.compiler.frontend.parser.ast;

/**
 * A statement of a compound block.
 */
public sealed interface StatementNode extends AstNode permits CompoundStatementNode, AssignStatementNode,
        IfStatementNode, WhileStatementNode, ProcedureCallStatementNode, ReturnStatementNode {
}
