package org.pascalvm.compiler.api;

/**
 * The contract violations that abort code generation.
 */
public enum CodeGenError {
    /** A variable or subprogram has no symbol table entry at the point of use. */
    UNRESOLVED_SYMBOL,
    /** A call reached the generator without the target chosen by overload resolution. */
    UNRESOLVED_CALL,
    /** An array variable is referenced but its bounds were never recorded. */
    MISSING_ARRAY_METADATA,
    /** An array was declared with its upper bound below its lower bound. */
    INVALID_ARRAY_BOUNDS,
    /** A return with a value appears outside of any subprogram. */
    MISSING_SUBPROGRAM_CONTEXT,
    /** An operator no emission rule covers. */
    UNSUPPORTED_OPERATOR
}
