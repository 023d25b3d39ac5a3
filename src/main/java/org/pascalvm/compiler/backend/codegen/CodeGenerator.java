package org.pascalvm.compiler.backend.codegen;

import org.pascalvm.compiler.api.CodeGenError;
import org.pascalvm.compiler.api.CodeGenerationException;
import org.pascalvm.compiler.config.CodeGenOptions;
import org.pascalvm.compiler.frontend.parser.ast.AssignStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.BinaryOpNode;
import org.pascalvm.compiler.frontend.parser.ast.BinaryOperator;
import org.pascalvm.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.pascalvm.compiler.frontend.parser.ast.CompoundStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.Declarations;
import org.pascalvm.compiler.frontend.parser.ast.ExpressionNode;
import org.pascalvm.compiler.frontend.parser.ast.FunctionCallExprNode;
import org.pascalvm.compiler.frontend.parser.ast.IAstVisitor;
import org.pascalvm.compiler.frontend.parser.ast.IdExprNode;
import org.pascalvm.compiler.frontend.parser.ast.IfStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.IntNumNode;
import org.pascalvm.compiler.frontend.parser.ast.ParameterDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.ProcedureCallStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.ProcedureHeadNode;
import org.pascalvm.compiler.frontend.parser.ast.ProgramNode;
import org.pascalvm.compiler.frontend.parser.ast.RealNumNode;
import org.pascalvm.compiler.frontend.parser.ast.ReturnStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.StatementNode;
import org.pascalvm.compiler.frontend.parser.ast.StringLiteralNode;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclarations;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramHead;
import org.pascalvm.compiler.frontend.parser.ast.TypeNode;
import org.pascalvm.compiler.frontend.parser.ast.UnaryOpNode;
import org.pascalvm.compiler.frontend.parser.ast.UnaryOperator;
import org.pascalvm.compiler.frontend.parser.ast.VarDecl;
import org.pascalvm.compiler.frontend.parser.ast.VariableNode;
import org.pascalvm.compiler.frontend.parser.ast.WhileStatementNode;
import org.pascalvm.compiler.frontend.semantics.ArrayDetails;
import org.pascalvm.compiler.frontend.semantics.NameMangler;
import org.pascalvm.compiler.frontend.semantics.SymbolEntry;
import org.pascalvm.compiler.frontend.semantics.SymbolKind;
import org.pascalvm.compiler.frontend.semantics.SymbolScope;
import org.pascalvm.compiler.frontend.semantics.SymbolTable;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Phase: generates stack-machine text from a type-checked AST in a single depth-first traversal.
 * <p>
 * Program layout: {@code start}, a jump over all subprogram bodies to the main label, the
 * subprograms, the main label, the global reservation and array allocations, the main block and
 * {@code stop}.
 * <p>
 * Frame model:
 * <ul>
 *   <li>Globals live at their pre-assigned offsets, reserved by one {@code pushn} for all scalar globals.</li>
 *   <li>Locals get offsets 0, 1, ... in declaration order; each declaration group reserves its own
 *       scalars with a {@code pushn}.</li>
 *   <li>Parameter {@code i} (declaration order) is addressed as {@code -(i+1)}; the return value of a
 *       function sits below all parameters at {@code -(numParameters+1)}.</li>
 *   <li>An array variable's slot holds the handle returned by {@code alloc}.</li>
 * </ul>
 * Calls push a return cell (functions only), the arguments in reverse order and the mangled
 * address, then {@code call} and pop the arguments.
 * <p>
 * Booleans are 0/1 integers; {@code and} and {@code or} are compiled as strict arithmetic over
 * that encoding and evaluate both operands.
 * <p>
 * Not thread-safe. One instance may be reused for several programs sequentially.
 */
public class CodeGenerator implements IAstVisitor {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private static final String WRITE = "write";
    private static final String WRITELN = "writeln";
    private static final String READ = "read";
    private static final String READLN = "readln";

    private final CodeGenOptions options;
    private final InstructionEmitter emitter;
    private final LabelAllocator labels = new LabelAllocator();

    private SymbolTable symbolTable;
    private CodeGenContext context;

    /**
     * Creates a generator with {@link CodeGenOptions#defaults()}.
     */
    public CodeGenerator() {
        this(CodeGenOptions.defaults());
    }

    public CodeGenerator(CodeGenOptions options) {
        this.options = options;
        this.emitter = new InstructionEmitter(options.traceInstructions());
    }

    /**
     * Generates the program text for a compilation unit.
     *
     * @param root        The program root.
     * @param symbolTable The table filled by semantic analysis, positioned at the global scope. The
     *                    generator opens and closes a scope per subprogram and leaves it at the
     *                    global scope again.
     * @return The instruction text, one line per instruction or label.
     * @throws CodeGenerationException at the first contract violation; no output is returned then.
     */
    public String generateCode(ProgramNode root, SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
        this.context = new CodeGenContext();
        emitter.reset();
        if (options.resetLabelsPerUnit()) {
            labels.reset();
        }
        try {
            root.accept(this);
            return emitter.build();
        } finally {
            this.symbolTable = null;
            this.context = null;
        }
    }

    /**
     * @return The number of lines emitted by the last {@link #generateCode} call.
     */
    public int emittedLineCount() {
        return emitter.lineCount();
    }

    // === Program and declarations ===

    @Override
    public void visit(ProgramNode node) {
        emitter.emit(Opcode.START);
        if (node.hasSubprograms()) {
            emitter.emit(Opcode.JUMP, options.mainLabel());
        }
        if (node.subprograms() != null) {
            node.subprograms().accept(this);
        }
        emitter.emitLabel(options.mainLabel());
        if (node.declarations() != null) {
            node.declarations().accept(this);
        }
        if (node.mainBlock() != null) {
            node.mainBlock().accept(this);
        }
        emitter.emit(Opcode.STOP);
    }

    @Override
    public void visit(Declarations node) {
        // Locals reserve per declaration group in visit(VarDecl)
        if (symbolTable.isGlobalScope()) {
            int scalarCount = 0;
            for (VarDecl decl : node.varDecls()) {
                if (decl.type().category() != TypeCategory.ARRAY) {
                    scalarCount += decl.identifiers().size();
                }
            }
            if (scalarCount > 0) {
                emitter.emit(Opcode.PUSHN, scalarCount);
            }
        }
        for (VarDecl decl : node.varDecls()) {
            decl.accept(this);
        }
    }

    @Override
    public void visit(VarDecl node) {
        TypeNode type = node.type();
        boolean isArray = type.category() == TypeCategory.ARRAY;
        if (isArray && type.arrayDetails().size() <= 0) {
            ArrayDetails details = type.arrayDetails();
            throw new CodeGenerationException(CodeGenError.INVALID_ARRAY_BOUNDS,
                    "Array size must be positive: " + node.identifiers()
                            + " declared as [" + details.lowBound() + ".." + details.highBound() + "]");
        }

        if (!symbolTable.isGlobalScope()) {
            int scalarCount = 0;
            for (String identifier : node.identifiers()) {
                SymbolEntry local = isArray
                        ? SymbolEntry.array(identifier, SymbolScope.LOCAL, type.arrayDetails())
                        : SymbolEntry.variable(identifier, type.category(), SymbolScope.LOCAL);
                symbolTable.addSymbol(local.assignOffset(context.nextLocalOffset()));
                if (!isArray) {
                    scalarCount++;
                }
            }
            if (scalarCount > 0) {
                emitter.emit(Opcode.PUSHN, scalarCount);
            }
        }

        // A local array's handle slot is not covered by any pushn; a later group's reservation reuses it
        if (isArray) {
            int size = type.arrayDetails().size();
            Opcode store = symbolTable.isGlobalScope() ? Opcode.STOREG : Opcode.STOREL;
            for (String identifier : node.identifiers()) {
                SymbolEntry entry = resolve(identifier, "during array allocation");
                emitter.emit(Opcode.ALLOC, size);
                emitter.emit(store, entry.offset());
            }
        }
    }

    // === Subprograms ===

    @Override
    public void visit(SubprogramDeclarations node) {
        for (SubprogramDeclaration subprogram : node.subprograms()) {
            subprogram.accept(this);
        }
    }

    @Override
    public void visit(SubprogramDeclaration node) {
        SymbolEntry entry = resolveSubprogramEntry(node);
        String mangledName = entry.mangledName();
        String endLabel = mangledName + "_end";
        log.debug("Generating {} '{}' as {}", entry.kind(), entry.name(), mangledName);

        CodeGenContext.Frame enclosing = context.enterSubprogram(entry, node.head());
        try {
            emitter.emit(Opcode.JUMP, endLabel);
            emitter.emitLabel(mangledName);

            symbolTable.enterScope();
            try {
                for (ParameterDeclaration parameters : node.head().parameters()) {
                    parameters.accept(this);
                }
                if (node.localDeclarations() != null) {
                    node.localDeclarations().accept(this);
                }
                node.body().accept(this);

                // Functions end with an explicit return statement
                if (context.currentHead() instanceof ProcedureHeadNode) {
                    emitter.emit(Opcode.RETURN);
                }
                emitter.emitLabel(endLabel);
            } finally {
                symbolTable.exitScope();
            }
        } finally {
            context.restore(enclosing);
        }
    }

    @Override
    public void visit(ParameterDeclaration node) {
        TypeNode type = node.type();
        ArrayDetails details = type.category() == TypeCategory.ARRAY ? type.arrayDetails() : null;
        for (String identifier : node.identifiers()) {
            SymbolEntry parameter = SymbolEntry.parameter(identifier, type.category(), details);
            symbolTable.addSymbol(parameter.assignOffset(context.nextParamOffset()));
        }
    }

    private SymbolEntry resolveSubprogramEntry(SubprogramDeclaration node) {
        if (node.resolvedEntry() != null) {
            return node.resolvedEntry();
        }
        SubprogramHead head = node.head();
        String mangledKey = NameMangler.mangle(head.kind(), head.name(), parameterTypes(head));
        return symbolTable.lookupSymbol(mangledKey).orElseThrow(() -> new CodeGenerationException(
                CodeGenError.UNRESOLVED_SYMBOL,
                "Could not find symbol table entry for subprogram: " + head.name() + " (" + mangledKey + ")"));
    }

    private static List<TypeCategory> parameterTypes(SubprogramHead head) {
        List<TypeCategory> types = new ArrayList<>();
        for (ParameterDeclaration group : head.parameters()) {
            for (int i = 0; i < group.identifiers().size(); i++) {
                types.add(group.type().category());
            }
        }
        return types;
    }

    // === Statements ===

    @Override
    public void visit(CompoundStatementNode node) {
        for (StatementNode statement : node.statements()) {
            statement.accept(this);
        }
    }

    @Override
    public void visit(AssignStatementNode node) {
        VariableNode target = node.target();
        if (target.isIndexed()) {
            SymbolEntry array = resolve(target.name(), "in array assignment");
            ArrayDetails details = requireArrayDetails(array);
            emitSlotLoad(array, target.scope());
            if (target.index() instanceof IntNumNode literal) {
                emitConverted(node.expression(), target.determinedType());
                emitter.emit(Opcode.STORE, literal.value() - details.lowBound());
            } else {
                emitZeroBasedIndex(target.index(), details);
                emitConverted(node.expression(), target.determinedType());
                emitter.emit(Opcode.STOREN);
            }
        } else {
            emitConverted(node.expression(), target.determinedType());
            SymbolEntry entry = resolve(target.name(), "in assignment");
            emitSlotStore(entry, target.scope());
        }
    }

    @Override
    public void visit(IfStatementNode node) {
        boolean hasElse = node.elseStatement() != null;
        String elseLabel = labels.newLabel(LabelAllocator.ELSE);
        String endLabel = labels.newLabel(LabelAllocator.END_IF);

        node.condition().accept(this);
        emitter.emit(Opcode.JZ, elseLabel);
        node.thenStatement().accept(this);
        if (hasElse) {
            emitter.emit(Opcode.JUMP, endLabel);
        }
        emitter.emitLabel(elseLabel);
        if (hasElse) {
            node.elseStatement().accept(this);
        }
        emitter.emitLabel(endLabel);
    }

    @Override
    public void visit(WhileStatementNode node) {
        String startLabel = labels.newLabel(LabelAllocator.WHILE_START);
        String endLabel = labels.newLabel(LabelAllocator.WHILE_END);
        emitter.emitLabel(startLabel);
        node.condition().accept(this);
        emitter.emit(Opcode.JZ, endLabel);
        node.body().accept(this);
        emitter.emit(Opcode.JUMP, startLabel);
        emitter.emitLabel(endLabel);
    }

    @Override
    public void visit(ReturnStatementNode node) {
        ExpressionNode value = node.returnValue();
        if (value != null) {
            SymbolEntry subprogram = context.currentSubprogram();
            if (subprogram == null) {
                throw new CodeGenerationException(CodeGenError.MISSING_SUBPROGRAM_CONTEXT,
                        "Return statement found with no subprogram context.");
            }
            emitConverted(value, subprogram.functionReturnType());
            emitter.emit(Opcode.STOREL, -(subprogram.numParameters() + 1));
        }
        emitter.emit(Opcode.RETURN);
    }

    @Override
    public void visit(ProcedureCallStatementNode node) {
        String name = node.procName().toLowerCase(Locale.ROOT);
        switch (name) {
            case WRITE, WRITELN -> {
                for (ExpressionNode argument : node.arguments()) {
                    argument.accept(this);
                    emitWrite(argument);
                }
                if (WRITELN.equals(name)) {
                    emitter.emit(Opcode.PUSHS, "\"\\n\"");
                    emitter.emit(Opcode.WRITES);
                }
            }
            case READ, READLN -> log.warn("'{}' is not supported by the code generator, no code emitted", node.procName());
            default -> emitCall(node.procName(), node.arguments(), node.resolvedEntry(), false);
        }
    }

    private void emitWrite(ExpressionNode argument) {
        if (argument instanceof StringLiteralNode) {
            emitter.emit(Opcode.WRITES);
        } else if (argument.determinedType() == TypeCategory.INTEGER || argument.determinedType() == TypeCategory.BOOLEAN) {
            emitter.emit(Opcode.WRITEI);
        } else if (argument.determinedType() == TypeCategory.REAL) {
            emitter.emit(Opcode.WRITEF);
        }
    }

    private void emitCall(String name, List<ExpressionNode> arguments, SymbolEntry target, boolean isFunction) {
        if (target == null) {
            throw new CodeGenerationException(CodeGenError.UNRESOLVED_CALL,
                    (isFunction ? "Function" : "Procedure") + " call to '" + name
                            + "' was not resolved by semantic analysis.");
        }
        if (isFunction) {
            emitter.emit(Opcode.PUSHN, 1);
        }
        for (int i = arguments.size() - 1; i >= 0; i--) {
            arguments.get(i).accept(this);
        }
        emitter.emit(Opcode.PUSHA, target.mangledName());
        emitter.emit(Opcode.CALL);
        if (target.numParameters() > 0) {
            emitter.emit(Opcode.POP, target.numParameters());
        }
    }

    // === Expressions ===

    @Override
    public void visit(VariableNode node) {
        SymbolEntry entry = resolve(node.name(), "");
        if (!node.isIndexed()) {
            emitSlotLoad(entry, node.scope());
            return;
        }
        ArrayDetails details = requireArrayDetails(entry);
        emitSlotLoad(entry, node.scope());
        if (node.index() instanceof IntNumNode literal) {
            emitter.emit(Opcode.LOAD, literal.value() - details.lowBound());
        } else {
            emitZeroBasedIndex(node.index(), details);
            emitter.emit(Opcode.LOADN);
        }
    }

    @Override
    public void visit(IdExprNode node) {
        if (node.kind() == SymbolKind.FUNCTION) {
            emitter.emit(Opcode.PUSHN, 1);
            emitter.emit(Opcode.PUSHA, NameMangler.mangle(SymbolKind.FUNCTION, node.name(), List.of()));
            emitter.emit(Opcode.CALL);
            return;
        }
        SymbolEntry entry = resolve(node.name(), "for identifier");
        emitSlotLoad(entry, node.scope());
    }

    @Override
    public void visit(FunctionCallExprNode node) {
        emitCall(node.funcName(), node.arguments(), node.resolvedEntry(), true);
    }

    @Override
    public void visit(IntNumNode node) {
        emitter.emit(Opcode.PUSHI, node.value());
    }

    @Override
    public void visit(RealNumNode node) {
        emitter.emit(Opcode.PUSHF, String.format(Locale.ROOT, "%f", node.value()));
    }

    @Override
    public void visit(BooleanLiteralNode node) {
        emitter.emit(Opcode.PUSHI, node.value() ? 1 : 0);
    }

    @Override
    public void visit(StringLiteralNode node) {
        emitter.emit(Opcode.PUSHS, "\"" + node.value() + "\"");
    }

    @Override
    public void visit(UnaryOpNode node) {
        UnaryOperator operator = UnaryOperator.fromToken(node.operator())
                .orElseThrow(() -> unsupportedOperator("unary", node.operator()));
        node.operand().accept(this);
        switch (operator) {
            case NEGATE -> {
                if (node.operand().determinedType() == TypeCategory.REAL) {
                    emitter.emit(Opcode.PUSHF, "0.0");
                    emitter.emit(Opcode.SWAP);
                    emitter.emit(Opcode.FSUB);
                } else {
                    emitter.emit(Opcode.PUSHI, 0);
                    emitter.emit(Opcode.SWAP);
                    emitter.emit(Opcode.SUB);
                }
            }
            case NOT -> emitter.emit(Opcode.NOT);
            case PLUS -> {
                // identity
            }
        }
    }

    @Override
    public void visit(BinaryOpNode node) {
        BinaryOperator operator = BinaryOperator.fromToken(node.operator())
                .orElseThrow(() -> unsupportedOperator("binary", node.operator()));
        boolean realOp = !operator.isLogical()
                && (node.left().determinedType() == TypeCategory.REAL
                || node.right().determinedType() == TypeCategory.REAL
                || operator == BinaryOperator.REAL_DIVIDE);

        emitOperand(node.left(), realOp);
        emitOperand(node.right(), realOp);

        switch (operator) {
            case ADD -> emitter.emit(realOp ? Opcode.FADD : Opcode.ADD);
            case SUBTRACT -> emitter.emit(realOp ? Opcode.FSUB : Opcode.SUB);
            case MULTIPLY -> emitter.emit(realOp ? Opcode.FMUL : Opcode.MUL);
            case REAL_DIVIDE -> emitter.emit(Opcode.FDIV);
            case INT_DIVIDE -> emitter.emit(Opcode.DIV);
            case EQUAL -> emitter.emit(Opcode.EQUAL);
            case NOT_EQUAL -> {
                emitter.emit(Opcode.EQUAL);
                emitter.emit(Opcode.NOT);
            }
            case LESS -> emitter.emit(realOp ? Opcode.FINF : Opcode.INF);
            case LESS_EQUAL -> emitter.emit(realOp ? Opcode.FINFEQ : Opcode.INFEQ);
            case GREATER -> emitter.emit(realOp ? Opcode.FSUP : Opcode.SUP);
            case GREATER_EQUAL -> emitter.emit(realOp ? Opcode.FSUPEQ : Opcode.SUPEQ);
            case AND -> emitter.emit(Opcode.MUL);
            case OR -> {
                emitter.emit(Opcode.ADD);
                emitter.emit(Opcode.PUSHI, 0);
                emitter.emit(Opcode.SUP);
            }
        }
    }

    // === Helpers ===

    private SymbolEntry resolve(String name, String where) {
        return symbolTable.lookupSymbol(name).orElseThrow(() -> new CodeGenerationException(
                CodeGenError.UNRESOLVED_SYMBOL,
                "Symbol not found" + (where.isEmpty() ? "" : " " + where) + ": " + name));
    }

    private static ArrayDetails requireArrayDetails(SymbolEntry entry) {
        if (!entry.arrayDetails().initialized()) {
            throw new CodeGenerationException(CodeGenError.MISSING_ARRAY_METADATA,
                    "Array details not found for " + entry.name());
        }
        return entry.arrayDetails();
    }

    private static CodeGenerationException unsupportedOperator(String arity, String operator) {
        return new CodeGenerationException(CodeGenError.UNSUPPORTED_OPERATOR,
                "Unsupported " + arity + " op '" + operator + "'");
    }

    private static int parameterSlot(SymbolEntry parameter) {
        return -(parameter.offset() + 1);
    }

    private void emitSlotLoad(SymbolEntry entry, SymbolScope scope) {
        if (entry.kind() == SymbolKind.PARAMETER) {
            emitter.emit(Opcode.PUSHL, parameterSlot(entry));
        } else if (scope == SymbolScope.LOCAL) {
            emitter.emit(Opcode.PUSHL, entry.offset());
        } else {
            emitter.emit(Opcode.PUSHG, entry.offset());
        }
    }

    private void emitSlotStore(SymbolEntry entry, SymbolScope scope) {
        if (entry.kind() == SymbolKind.PARAMETER) {
            emitter.emit(Opcode.STOREL, parameterSlot(entry));
        } else if (scope == SymbolScope.LOCAL) {
            emitter.emit(Opcode.STOREL, entry.offset());
        } else {
            emitter.emit(Opcode.STOREG, entry.offset());
        }
    }

    /**
     * Evaluates {@code index - lowBound} at runtime.
     */
    private void emitZeroBasedIndex(ExpressionNode index, ArrayDetails details) {
        index.accept(this);
        emitter.emit(Opcode.PUSHI, details.lowBound());
        emitter.emit(Opcode.SUB);
    }

    /**
     * Evaluates {@code value} and promotes it to real when it is stored into a real-typed slot.
     */
    private void emitConverted(ExpressionNode value, TypeCategory targetType) {
        value.accept(this);
        if (targetType == TypeCategory.REAL && value.determinedType() == TypeCategory.INTEGER) {
            emitter.emit(Opcode.ITOF);
        }
    }

    private void emitOperand(ExpressionNode operand, boolean realOp) {
        operand.accept(this);
        if (realOp && operand.determinedType() == TypeCategory.INTEGER) {
            emitter.emit(Opcode.ITOF);
        }
    }
}
