package org.pascalvm.compiler.frontend.semantics;

/**
 * The kind of entity a {@link SymbolEntry} describes.
 */
public enum SymbolKind {
    /** A declared variable, global or local. */
    VARIABLE,
    /** A formal parameter of a subprogram. */
    PARAMETER,
    /** A subprogram with a return value. */
    FUNCTION,
    /** A subprogram without a return value. */
    PROCEDURE
}
