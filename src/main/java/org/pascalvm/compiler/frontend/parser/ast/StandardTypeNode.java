package org.pascalvm.compiler.frontend.parser.ast;

import org.pascalvm.compiler.frontend.semantics.ArrayDetails;
import org.pascalvm.compiler.frontend.semantics.TypeCategory;

/**
 * One of the primitive types {@code integer}, {@code real} or {@code boolean}.
 *
 * @param category The primitive category.
 */
public record StandardTypeNode(TypeCategory category) implements TypeNode {

    public static final StandardTypeNode INTEGER = new StandardTypeNode(TypeCategory.INTEGER);
    public static final StandardTypeNode REAL = new StandardTypeNode(TypeCategory.REAL);
    public static final StandardTypeNode BOOLEAN = new StandardTypeNode(TypeCategory.BOOLEAN);

    @Override
    public ArrayDetails arrayDetails() {
        return ArrayDetails.UNINITIALIZED;
    }
}
