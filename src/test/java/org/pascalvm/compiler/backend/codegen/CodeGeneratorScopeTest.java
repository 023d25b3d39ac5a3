package org.pascalvm.compiler.backend.codegen;

import org.pascalvm.compiler.api.CodeGenerationException;
import org.pascalvm.compiler.frontend.parser.ast.AssignStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.CompoundStatementNode;
import org.pascalvm.compiler.frontend.parser.ast.IntNumNode;
import org.pascalvm.compiler.frontend.parser.ast.ParameterDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.ProcedureHeadNode;
import org.pascalvm.compiler.frontend.parser.ast.ProgramNode;
import org.pascalvm.compiler.frontend.parser.ast.StandardTypeNode;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclaration;
import org.pascalvm.compiler.frontend.parser.ast.SubprogramDeclarations;
import org.pascalvm.compiler.frontend.parser.ast.VariableNode;
import org.pascalvm.compiler.frontend.semantics.SymbolEntry;
import org.pascalvm.compiler.frontend.semantics.SymbolKind;
import org.pascalvm.compiler.frontend.semantics.SymbolScope;
import org.pascalvm.compiler.frontend.semantics.SymbolTable;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the calls {@link CodeGenerator} makes on the {@link SymbolTable} around subprogram bodies.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CodeGeneratorScopeTest {

    private static final CompoundStatementNode EMPTY_BODY = new CompoundStatementNode(List.of());

    @Mock
    private SymbolTable symbolTable;
    private CodeGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CodeGenerator();
    }

    @Test
    void eachSubprogramOpensAndClosesItsOwnScope() {
        generator.generateCode(programWith(procedure("a", List.of()), procedure("b", List.of())), symbolTable);

        InOrder order = inOrder(symbolTable);
        order.verify(symbolTable).enterScope();
        order.verify(symbolTable).exitScope();
        order.verify(symbolTable).enterScope();
        order.verify(symbolTable).exitScope();
        verify(symbolTable, never()).lookupSymbol(anyString());
    }

    @Test
    void parametersAreRegisteredInsideTheSubprogramScope() {
        ParameterDeclaration params = new ParameterDeclaration(List.of("a", "b"), StandardTypeNode.INTEGER);

        generator.generateCode(programWith(procedure("p", List.of(params))), symbolTable);

        ArgumentCaptor<SymbolEntry> registered = ArgumentCaptor.forClass(SymbolEntry.class);
        InOrder order = inOrder(symbolTable);
        order.verify(symbolTable).enterScope();
        order.verify(symbolTable, times(2)).addSymbol(registered.capture());
        order.verify(symbolTable).exitScope();
        assertThat(registered.getAllValues())
                .extracting(SymbolEntry::name, SymbolEntry::kind, SymbolEntry::offset)
                .containsExactly(tuple("a", SymbolKind.PARAMETER, 0), tuple("b", SymbolKind.PARAMETER, 1));
    }

    @Test
    void scopeIsClosedWhenTheBodyFails() {
        when(symbolTable.lookupSymbol("ghost")).thenReturn(Optional.empty());
        CompoundStatementNode body = new CompoundStatementNode(List.of(new AssignStatementNode(
                new VariableNode("ghost", null, SymbolScope.LOCAL, TypeCategory.INTEGER), new IntNumNode(1))));
        SubprogramDeclaration broken = new SubprogramDeclaration(new ProcedureHeadNode("p", List.of()), null, body,
                SymbolEntry.procedure("p", List.of()));

        assertThatThrownBy(() -> generator.generateCode(programWith(broken), symbolTable))
                .isInstanceOf(CodeGenerationException.class);

        InOrder order = inOrder(symbolTable);
        order.verify(symbolTable).enterScope();
        order.verify(symbolTable).exitScope();
    }

    private static SubprogramDeclaration procedure(String name, List<ParameterDeclaration> parameters) {
        List<TypeCategory> types = parameters.stream()
                .flatMap(group -> group.identifiers().stream().map(id -> group.type().category()))
                .toList();
        return new SubprogramDeclaration(new ProcedureHeadNode(name, parameters), null, EMPTY_BODY,
                SymbolEntry.procedure(name, types));
    }

    private static ProgramNode programWith(SubprogramDeclaration... definitions) {
        return new ProgramNode("scopes", null, new SubprogramDeclarations(List.of(definitions)), EMPTY_BODY);
    }
}
