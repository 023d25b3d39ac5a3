package org.pascalvm.compiler;

import org.pascalvm.compiler.backend.codegen.CodeGenerator;
import org.pascalvm.compiler.frontend.parser.ast.ArrayTypeNode;
import org.pascalvm.compiler.frontend.parser.ast.AssignStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.BinaryOpNode;
import org.pascalvm.compiler.frontend.parser.ast.CompoundStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.Declarations;
import org.pascalvm.compiler.frontend.parser.ast.ExpressionNode;
import org.pascalvm.compiler.frontend.parser.ast.FunctionCallExprNode;
import org.pascalvm.compiler.frontend.parser.ast.FunctionHeadNode;
import org.pascalvm.compiler.frontend.parser.ast.IntNumNode;
import org.pascalvm.compiler.frontend.parser.ast.ParameterDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.ProcedureCallStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.ProcedureHeadNode;
import org.pascalvm.compiler.frontend.parser.ast.ProgramNode;
import org.pascalvm.compiler.frontend.parser.ast.RealNumNode;
import org.pascalvm.compiler.frontend.parser.ast.StandardTypeNode;
import org.pascalvm.compiler.frontend.parser.ast.StatementNode;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclarations;
import org.pascalvm.compiler.frontend.parser.ast.TypeNode;
import org.pascalvm.compiler.frontend.parser.ast.VarDecl;
import org.pascalvm.compiler.frontend.parser.ast.VariableNode;
import org.pascalvm.compiler.frontend.semantics.ArrayDetails;
import org.pascalvm.compiler.frontend.semantics.SymbolEntry;
import org.pascalvm.compiler.frontend.semantics.SymbolScope;
import org.pascalvm.compiler.frontend.semantics.SymbolTable;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;
import org.junit.jupiter.api.BeforeEach;

import java.util.Arrays;
import java.util.List;

/**
 * Shared fixtures for code generation tests: a fresh symbol table playing the role of semantic
 * analysis, and terse builders for typed AST fragments.
 */
public abstract class CodeGenTestBase {

    protected static final StandardTypeNode INTEGER_TYPE = StandardTypeNode.INTEGER;
    protected static final StandardTypeNode REAL_TYPE = StandardTypeNode.REAL;
    protected static final StandardTypeNode BOOLEAN_TYPE = StandardTypeNode.BOOLEAN;

    protected SymbolTable symbolTable;
    protected CodeGenerator generator;

    @BeforeEach
    protected void setUpCodeGen() {
        symbolTable = new SymbolTable();
        generator = new CodeGenerator();
    }

    protected List<String> generate(ProgramNode program) {
        return lines(generator.generateCode(program, symbolTable));
    }

    protected static List<String> lines(String code) {
        return Arrays.asList(code.split("\n"));
    }

    /**
     * Generates a program without declarations or subprograms and returns the lines of the main block.
     */
    protected List<String> generateMain(StatementNode... statements) {
        List<String> all = generate(program(null, null, statements));
        return all.subList(all.indexOf("main_entry:") + 1, all.size() - 1);
    }

    // === Symbols registered by "semantic analysis" ===

    protected SymbolEntry global(String name, TypeCategory type, int offset) {
        SymbolEntry entry = SymbolEntry.variable(name, type, SymbolScope.GLOBAL).assignOffset(offset);
        symbolTable.addSymbol(entry);
        return entry;
    }

    protected SymbolEntry globalArray(String name, int low, int high, TypeCategory elementType, int offset) {
        SymbolEntry entry = SymbolEntry.array(name, SymbolScope.GLOBAL, new ArrayDetails(low, high, elementType))
                .assignOffset(offset);
        symbolTable.addSymbol(entry);
        return entry;
    }

    protected SymbolEntry function(String name, TypeCategory returnType, TypeCategory... parameterTypes) {
        SymbolEntry entry = SymbolEntry.function(name, List.of(parameterTypes), returnType);
        symbolTable.addSymbol(entry);
        return entry;
    }

    protected SymbolEntry procedure(String name, TypeCategory... parameterTypes) {
        SymbolEntry entry = SymbolEntry.procedure(name, List.of(parameterTypes));
        symbolTable.addSymbol(entry);
        return entry;
    }

    // === AST builders ===

    protected static ProgramNode program(Declarations declarations, SubprogramDeclarations subprograms,
                                         StatementNode... main) {
        return new ProgramNode("test", declarations, subprograms, block(main));
    }

    protected static CompoundStatementNode block(StatementNode... statements) {
        return new CompoundStatementNode(List.of(statements));
    }

    protected static Declarations decls(VarDecl... groups) {
        return new Declarations(List.of(groups));
    }

    protected static VarDecl var(TypeNode type, String... identifiers) {
        return new VarDecl(List.of(identifiers), type);
    }

    protected static ParameterDeclaration param(TypeNode type, String... identifiers) {
        return new ParameterDeclaration(List.of(identifiers), type);
    }

    protected static ArrayTypeNode arrayOf(int low, int high, StandardTypeNode elementType) {
        return new ArrayTypeNode(low, high, elementType);
    }

    protected static SubprogramDeclarations subprograms(SubprogramDeclaration... definitions) {
        return new SubprogramDeclarations(List.of(definitions));
    }

    protected static SubprogramDeclaration procedureDef(String name, List<ParameterDeclaration> parameters,
                                                        Declarations locals, StatementNode... body) {
        return new SubprogramDeclaration(new ProcedureHeadNode(name, parameters), locals, block(body));
    }

    protected static SubprogramDeclaration functionDef(String name, List<ParameterDeclaration> parameters,
                                                       StandardTypeNode returnType, Declarations locals,
                                                       StatementNode... body) {
        return new SubprogramDeclaration(new FunctionHeadNode(name, parameters, returnType), locals, block(body));
    }

    protected static IntNumNode num(int value) {
        return new IntNumNode(value);
    }

    protected static RealNumNode real(double value) {
        return new RealNumNode(value);
    }

    protected static VariableNode globalVar(String name, TypeCategory type) {
        return new VariableNode(name, null, SymbolScope.GLOBAL, type);
    }

    protected static VariableNode localVar(String name, TypeCategory type) {
        return new VariableNode(name, null, SymbolScope.LOCAL, type);
    }

    protected static VariableNode element(String name, ExpressionNode index, SymbolScope scope, TypeCategory type) {
        return new VariableNode(name, index, scope, type);
    }

    protected static AssignStatementNode assign(VariableNode target, ExpressionNode expression) {
        return new AssignStatementNode(target, expression);
    }

    protected static BinaryOpNode binary(String operator, ExpressionNode left, ExpressionNode right,
                                         TypeCategory type) {
        return new BinaryOpNode(operator, left, right, type);
    }

    protected static ProcedureCallStatementNode call(String name, SymbolEntry target, ExpressionNode... arguments) {
        return new ProcedureCallStatementNode(name, List.of(arguments), target);
    }

    protected static FunctionCallExprNode callExpr(String name, SymbolEntry target, ExpressionNode... arguments) {
        TypeCategory type = target != null ? target.functionReturnType() : TypeCategory.UNKNOWN;
        return new FunctionCallExprNode(name, List.of(arguments), target, type);
    }

    protected static ProcedureCallStatementNode write(ExpressionNode... arguments) {
        return new ProcedureCallStatementNode("write", List.of(arguments), null);
    }
}
