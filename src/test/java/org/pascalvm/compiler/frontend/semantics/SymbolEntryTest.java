package org.pascalvm.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SymbolEntryTest {

    @Test
    void offsetCanBeAssignedOnlyOnce() {
        SymbolEntry entry = SymbolEntry.variable("x", TypeCategory.INTEGER, SymbolScope.GLOBAL);
        assertThat(entry.hasOffset()).isFalse();

        entry.assignOffset(4);

        assertThat(entry.offset()).isEqualTo(4);
        assertThatThrownBy(() -> entry.assignOffset(5)).isInstanceOf(IllegalStateException.class);
        assertThat(entry.offset()).isEqualTo(4);
    }

    @Test
    void readingUnassignedOffsetFails() {
        SymbolEntry entry = SymbolEntry.parameter("p", TypeCategory.REAL, null);

        assertThatThrownBy(entry::offset).isInstanceOf(IllegalStateException.class).hasMessageContaining("'p'");
    }

    @Test
    void scalarParameterHasNoArrayDetails() {
        SymbolEntry entry = SymbolEntry.parameter("p", TypeCategory.REAL, null);

        assertThat(entry.kind()).isEqualTo(SymbolKind.PARAMETER);
        assertThat(entry.arrayDetails().initialized()).isFalse();
    }

    @Test
    void functionKnowsItsSignature() {
        SymbolEntry entry = SymbolEntry.function("avg", List.of(TypeCategory.ARRAY, TypeCategory.INTEGER), TypeCategory.REAL);

        assertThat(entry.isSubprogram()).isTrue();
        assertThat(entry.numParameters()).isEqualTo(2);
        assertThat(entry.functionReturnType()).isEqualTo(TypeCategory.REAL);
        assertThat(entry.key()).isEqualTo("f_avg_a_i");
    }

    @Test
    void procedureHasNoReturnType() {
        SymbolEntry entry = SymbolEntry.procedure("log", List.of());

        assertThat(entry.functionReturnType()).isNull();
        assertThat(entry.key()).isEqualTo("p_log");
    }

    @Test
    void arraySizeCountsBothBounds() {
        assertThat(new ArrayDetails(5, 9, TypeCategory.INTEGER).size()).isEqualTo(5);
        assertThat(new ArrayDetails(-2, 2, TypeCategory.REAL).size()).isEqualTo(5);
        assertThat(new ArrayDetails(3, 1, TypeCategory.REAL).size()).isLessThanOrEqualTo(0);
    }
}
