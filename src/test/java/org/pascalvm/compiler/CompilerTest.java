package org.pascalvm.compiler;

import com.typesafe.config.ConfigFactory;
import org.pascalvm.compiler.api.CodeGenError;
import org.pascalvm.compiler.api.CodeGenerationException;
import org.pascalvm.compiler.config.CodeGenOptions;
import org.pascalvm.compiler.frontend.parser.ast.ProgramNode;
import org.pascalvm.compiler.frontend.parser.ast.ReturnStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.WhileStatementNode;
import org.pascalvm.compiler.frontend.semantics.SymbolEntry;
import org.pascalvm.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pascalvm.compiler.frontend.semantics.TypeCategory.BOOLEAN;
import static org.pascalvm.compiler.frontend.semantics.TypeCategory.INTEGER;
import static org.pascalvm.compiler.frontend.semantics.TypeCategory.REAL;

/**
 * End-to-end tests of the {@link Compiler} facade on complete programs.
 */
@Tag("unit")
class CompilerTest extends CodeGenTestBase {

    @Test
    void compilesProgramWithFunctionLoopAndOutput() {
        global("n", INTEGER, 0);
        global("total", REAL, 1);
        SymbolEntry square = function("square", INTEGER, INTEGER);
        ProgramNode program = program(
                decls(var(INTEGER_TYPE, "n"), var(REAL_TYPE, "total")),
                subprograms(functionDef("square", List.of(param(INTEGER_TYPE, "v")), INTEGER_TYPE, null,
                        new ReturnStatementNode(binary("*", localVar("v", INTEGER), localVar("v", INTEGER), INTEGER)))),
                assign(globalVar("n", INTEGER), num(0)),
                new WhileStatementNode(binary("<", globalVar("n", INTEGER), num(3), BOOLEAN), block(
                        assign(globalVar("total", REAL),
                                binary("+", globalVar("total", REAL), callExpr("square", square, globalVar("n", INTEGER)), REAL)),
                        assign(globalVar("n", INTEGER), binary("+", globalVar("n", INTEGER), num(1), INTEGER)))),
                write(globalVar("total", REAL)));

        String code = new Compiler(CodeGenOptions.defaults()).compile(program, symbolTable);

        assertThat(lines(code)).containsExactly(
                "    start",
                "    jump main_entry",
                "    jump f_square_i_end",
                "f_square_i:",
                "    pushl -1",
                "    pushl -1",
                "    mul",
                "    storel -2",
                "    return",
                "f_square_i_end:",
                "main_entry:",
                "    pushn 2",
                "    pushi 0",
                "    storeg 0",
                "L_WHILE_START_0:",
                "    pushg 0",
                "    pushi 3",
                "    inf",
                "    jz L_WHILE_END_1",
                "    pushg 1",
                "    pushn 1",
                "    pushg 0",
                "    pusha f_square_i",
                "    call",
                "    pop 1",
                "    itof",
                "    fadd",
                "    storeg 1",
                "    pushg 0",
                "    pushi 1",
                "    add",
                "    storeg 0",
                "    jump L_WHILE_START_0",
                "L_WHILE_END_1:",
                "    pushg 1",
                "    writef",
                "    stop");
        assertThat(symbolTable.isGlobalScope()).isTrue();
    }

    @Test
    void configuredCompilerUsesConfiguredMainLabel() {
        Compiler compiler = new Compiler(ConfigFactory.parseString("pascalvm.codegen.main-label = begin_here")
                .withFallback(ConfigFactory.defaultReference()));

        String code = compiler.compile(program(null, null), new SymbolTable());

        assertThat(code).isEqualTo("    start\nbegin_here:\n    stop\n");
    }

    @Test
    void defaultCompilerUsesReferenceConfiguration() {
        assertThat(new Compiler().compile(program(null, null), new SymbolTable()))
                .isEqualTo("    start\nmain_entry:\n    stop\n");
    }

    @Test
    void failuresArePropagatedUnchanged() {
        Compiler compiler = new Compiler(CodeGenOptions.defaults());

        assertThatThrownBy(() -> compiler.compile(program(null, null, new ReturnStatementNode(num(0))), symbolTable))
                .isInstanceOf(CodeGenerationException.class)
                .extracting(e -> ((CodeGenerationException) e).getError())
                .isEqualTo(CodeGenError.MISSING_SUBPROGRAM_CONTEXT);
    }
}
