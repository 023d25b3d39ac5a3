package org.pascalvm.compiler.frontend.semantics;

/**
 * Storage class of a variable: the global frame or the frame of the enclosing subprogram.
 */
public enum SymbolScope {
    GLOBAL,
    LOCAL
}
