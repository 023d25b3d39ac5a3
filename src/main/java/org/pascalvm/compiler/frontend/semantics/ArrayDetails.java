package org.pascalvm.compiler.frontend.semantics;

/**
 * Bounds and element type of an array declaration.
 *
 * @param lowBound    The declared lower index bound.
 * @param highBound   The declared upper index bound.
 * @param elementType The primitive type of the elements.
 * @param initialized Whether the bounds were actually recorded for the owning symbol.
 */
public record ArrayDetails(int lowBound, int highBound, TypeCategory elementType, boolean initialized) {

    /**
     * Placeholder for symbols whose array bounds were never recorded.
     */
    public static final ArrayDetails UNINITIALIZED = new ArrayDetails(0, 0, TypeCategory.UNKNOWN, false);

    /**
     * Creates recorded array details.
     */
    public ArrayDetails(int lowBound, int highBound, TypeCategory elementType) {
        this(lowBound, highBound, elementType, true);
    }

    /**
     * @return The number of cells, {@code highBound - lowBound + 1}. Not positive for inverted bounds.
     */
    public int size() {
        return highBound - lowBound + 1;
    }
}
