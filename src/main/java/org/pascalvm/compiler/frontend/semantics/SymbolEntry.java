package org.pascalvm.compiler.frontend.semantics;

import java.util.List;

/**
 * A single entry of the {@link SymbolTable}: a variable, a formal parameter or a subprogram.
 * <p>
 * The storage offset is assigned exactly once, when the declaration is visited, and never
 * changes afterwards. Its meaning depends on the kind: a slot in the global frame, a slot in
 * the local frame, or (for parameters) the index of the parameter in declaration order.
 * Subprogram entries carry their formal parameter types and are addressed by their
 * {@link #mangledName()}.
 */
public final class SymbolEntry {

    private final String name;
    private final SymbolKind kind;
    private final TypeCategory typeCategory;
    private final SymbolScope scope;
    private final ArrayDetails arrayDetails;
    private final List<TypeCategory> parameterTypes;
    private final TypeCategory functionReturnType;
    private Integer offset;

    private SymbolEntry(String name, SymbolKind kind, TypeCategory typeCategory, SymbolScope scope,
                        ArrayDetails arrayDetails, List<TypeCategory> parameterTypes,
                        TypeCategory functionReturnType) {
        this.name = name;
        this.kind = kind;
        this.typeCategory = typeCategory;
        this.scope = scope;
        this.arrayDetails = arrayDetails;
        this.parameterTypes = List.copyOf(parameterTypes);
        this.functionReturnType = functionReturnType;
    }

    /**
     * Creates a scalar variable entry.
     */
    public static SymbolEntry variable(String name, TypeCategory type, SymbolScope scope) {
        return new SymbolEntry(name, SymbolKind.VARIABLE, type, scope, ArrayDetails.UNINITIALIZED, List.of(), null);
    }

    /**
     * Creates an array variable entry.
     */
    public static SymbolEntry array(String name, SymbolScope scope, ArrayDetails details) {
        return new SymbolEntry(name, SymbolKind.VARIABLE, TypeCategory.ARRAY, scope, details, List.of(), null);
    }

    /**
     * Creates a formal parameter entry.
     *
     * @param details Array details for array parameters, or {@code null}.
     */
    public static SymbolEntry parameter(String name, TypeCategory type, ArrayDetails details) {
        return new SymbolEntry(name, SymbolKind.PARAMETER, type, SymbolScope.LOCAL,
                details != null ? details : ArrayDetails.UNINITIALIZED, List.of(), null);
    }

    /**
     * Creates a function entry.
     */
    public static SymbolEntry function(String name, List<TypeCategory> parameterTypes, TypeCategory returnType) {
        return new SymbolEntry(name, SymbolKind.FUNCTION, returnType, SymbolScope.GLOBAL,
                ArrayDetails.UNINITIALIZED, parameterTypes, returnType);
    }

    /**
     * Creates a procedure entry.
     */
    public static SymbolEntry procedure(String name, List<TypeCategory> parameterTypes) {
        return new SymbolEntry(name, SymbolKind.PROCEDURE, TypeCategory.UNKNOWN, SymbolScope.GLOBAL,
                ArrayDetails.UNINITIALIZED, parameterTypes, null);
    }

    /**
     * Assigns the storage offset.
     *
     * @param offset The offset.
     * @return This entry, for chaining.
     * @throws IllegalStateException if an offset was already assigned.
     */
    public SymbolEntry assignOffset(int offset) {
        if (this.offset != null) {
            throw new IllegalStateException("Offset of '" + name + "' is already assigned (" + this.offset + ")");
        }
        this.offset = offset;
        return this;
    }

    /**
     * @return The storage offset.
     * @throws IllegalStateException if no offset has been assigned yet.
     */
    public int offset() {
        if (offset == null) {
            throw new IllegalStateException("Offset of '" + name + "' has not been assigned");
        }
        return offset;
    }

    public boolean hasOffset() {
        return offset != null;
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public TypeCategory typeCategory() {
        return typeCategory;
    }

    public SymbolScope scope() {
        return scope;
    }

    public ArrayDetails arrayDetails() {
        return arrayDetails;
    }

    public boolean isSubprogram() {
        return kind == SymbolKind.FUNCTION || kind == SymbolKind.PROCEDURE;
    }

    public List<TypeCategory> parameterTypes() {
        return parameterTypes;
    }

    public int numParameters() {
        return parameterTypes.size();
    }

    /**
     * @return The declared return type, or {@code null} unless this is a function.
     */
    public TypeCategory functionReturnType() {
        return functionReturnType;
    }

    /**
     * @return The key under which this entry is registered: the mangled name for
     *         subprograms, the plain name otherwise.
     */
    public String key() {
        return isSubprogram() ? mangledName() : name;
    }

    /**
     * @return The mangled name of this subprogram.
     * @throws IllegalArgumentException if this entry is not a subprogram.
     */
    public String mangledName() {
        return NameMangler.mangle(kind, name, parameterTypes);
    }

    @Override
    public String toString() {
        return "SymbolEntry[" + kind + " " + key() + ": " + typeCategory + ", " + scope
                + (offset != null ? ", offset=" + offset : "") + "]";
    }
}
