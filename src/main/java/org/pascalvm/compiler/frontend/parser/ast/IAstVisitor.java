package org.pascalvm.compiler.frontend.parser.ast;

/**
 * Double-dispatch visitor over the closed set of {@link AstNode} variants.
 * Adding a node type forces every visitor to handle it.
 */
public interface IAstVisitor {

    void visit(ProgramNode node);

    void visit(Declarations node);

    void visit(VarDecl node);

    void visit(SubprogramDeclarations node);

    void visit(SubprogramDeclaration node);

    void visit(ParameterDeclaration node);

    void visit(CompoundStatementNode node);

    void visit(AssignStatementNode node);

    void visit(IfStatementNode node);

    void visit(WhileStatementNode node);

    void visit(ProcedureCallStatementNode node);

    void visit(ReturnStatementNode node);

    void visit(VariableNode node);

    void visit(IdExprNode node);

    void visit(FunctionCallExprNode node);

    void visit(IntNumNode node);

    void visit(RealNumNode node);

    void visit(BooleanLiteralNode node);

    void visit(StringLiteralNode node);

    void visit(UnaryOpNode node);

    void visit(BinaryOpNode node);
}
