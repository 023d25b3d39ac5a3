package org.pascalvm.compiler.frontend.semantics;

import java.util.List;

/**
 * Builds the type-signature-encoded names that identify overloaded subprograms.
 * <p>
 * A mangled name is {@code f_} (function) or {@code p_} (procedure), the declared name,
 * and for every formal parameter in declaration order an underscore followed by the
 * parameter's {@link TypeCategory#mangleCode()}. For example a function
 * {@code max(integer, real)} becomes {@code f_max_i_r}.
 * <p>
 * The same key is used by semantic analysis to register subprograms in the
 * {@link SymbolTable}, and by code generation both to find a definition's entry
 * and as the label of the subprogram's entry point.
 */
public final class NameMangler {

    public static final String FUNCTION_PREFIX = "f_";
    public static final String PROCEDURE_PREFIX = "p_";

    private NameMangler() {
    }

    /**
     * Mangles a subprogram name.
     *
     * @param kind           {@link SymbolKind#FUNCTION} or {@link SymbolKind#PROCEDURE}.
     * @param name           The declared (surface) name.
     * @param parameterTypes The formal parameter types in declaration order.
     * @return The mangled name.
     * @throws IllegalArgumentException if {@code kind} is not a subprogram kind.
     */
    public static String mangle(SymbolKind kind, String name, List<TypeCategory> parameterTypes) {
        StringBuilder sb = new StringBuilder();
        switch (kind) {
            case FUNCTION -> sb.append(FUNCTION_PREFIX);
            case PROCEDURE -> sb.append(PROCEDURE_PREFIX);
            default -> throw new IllegalArgumentException("Only subprograms have mangled names, got " + kind + " for '" + name + "'");
        }
        sb.append(name);
        for (TypeCategory type : parameterTypes) {
            sb.append('_').append(type.mangleCode());
        }
        return sb.toString();
    }
}
