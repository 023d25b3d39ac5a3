package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.ArrayDetails;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * A type denotation in a variable or parameter declaration.
 */
public sealed interface TypeNode permits StandardTypeNode, ArrayTypeNode {

    /**
     * @return The category of the denoted type.
     */
    TypeCategory category();

    /**
     * @return The array bounds for array types, {@link ArrayDetails#UNINITIALIZED} otherwise.
     */
    ArrayDetails arrayDetails();
}
