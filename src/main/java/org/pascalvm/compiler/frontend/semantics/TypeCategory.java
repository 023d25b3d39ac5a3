package org.pascalvm.compiler.frontend.semantics;

/**
 * The coarse type categories the code generator distinguishes.
 * Each category carries the one-letter code used when mangling subprogram names.
 */
public enum TypeCategory {
    INTEGER('i'),
    REAL('r'),
    BOOLEAN('b'),
    ARRAY('a'),
    UNKNOWN('u');

    private final char mangleCode;

    TypeCategory(char mangleCode) {
        this.mangleCode = mangleCode;
    }

    /**
     * @return The single character appended to a mangled subprogram name for a parameter of this type.
     */
    public char mangleCode() {
        return mangleCode;
    }
}
