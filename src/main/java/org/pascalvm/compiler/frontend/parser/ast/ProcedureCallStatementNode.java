package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.SymbolEntry;

import java.util.List;

/**
 * A procedure call used as a statement, either a built-in I/O routine or a user procedure.
 *
 * @param procName      The called name as written.
 * @param arguments     The actual arguments in source order.
 * @param resolvedEntry The overload chosen by semantic analysis; {@code null} for built-ins
 *                      or when resolution failed.
 */
public record ProcedureCallStatementNode(
        String procName,
        List<ExpressionNode> arguments,
        SymbolEntry resolvedEntry
) implements StatementNode {

    /**
     * A missing argument list is treated as empty.
     */
    public ProcedureCallStatementNode {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public void accept(IAstVisitor visitor) {
        visitor.visit(this);
    }
}
