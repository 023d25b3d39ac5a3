package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.ArrayDetails;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * {@code array [lowBound .. highBound] of elementType}.
 *
 * @param lowBound    The literal lower bound.
 * @param highBound   The literal upper bound.
 * @param elementType The element type.
 */
public record ArrayTypeNode(int lowBound, int highBound, StandardTypeNode elementType) implements TypeNode {

    @Override
    public TypeCategory category() {
        return TypeCategory.ARRAY;
    }

    @Override
    public ArrayDetails arrayDetails() {
        return new ArrayDetails(lowBound, highBound, elementType.category());
    }
}
