package org.pascalvm.compiler.backend.codegen;

import org.pascalvm.compiler.frontend.parser.ast.SubprogramHead;
import org.pascalvm.compiler.frontend.semantics.SymbolEntry;

/**
 * Mutable state of one code generation run: the subprogram being generated and the next free
 * local and parameter offsets.
 * <p>
 * Entering a subprogram returns a {@link Frame} holding the enclosing state; the caller hands it
 * back to {@link #restore(Frame)} when the subprogram is done, so nesting follows the call/return
 * order of the traversal.
 */
public class CodeGenContext {

    /**
     * Snapshot of the enclosing state taken when a subprogram is entered.
     */
    public record Frame(SymbolEntry subprogram, SubprogramHead head, int localOffset, int paramOffset) {
    }

    private SymbolEntry currentSubprogram;
    private SubprogramHead currentHead;
    private int localOffset;
    private int paramOffset;

    /**
     * Makes {@code entry} the current subprogram and resets both offset counters to 0.
     *
     * @param entry The entry of the subprogram being generated.
     * @param head  Its declaration head.
     * @return The enclosing state, to be passed to {@link #restore(Frame)}.
     */
    public Frame enterSubprogram(SymbolEntry entry, SubprogramHead head) {
        Frame saved = new Frame(currentSubprogram, currentHead, localOffset, paramOffset);
        currentSubprogram = entry;
        currentHead = head;
        localOffset = 0;
        paramOffset = 0;
        return saved;
    }

    public void restore(Frame frame) {
        currentSubprogram = frame.subprogram();
        currentHead = frame.head();
        localOffset = frame.localOffset();
        paramOffset = frame.paramOffset();
    }

    /**
     * @return The subprogram being generated, or {@code null} at top level.
     */
    public SymbolEntry currentSubprogram() {
        return currentSubprogram;
    }

    /**
     * @return The head of the subprogram being generated, or {@code null} at top level.
     */
    public SubprogramHead currentHead() {
        return currentHead;
    }

    public int nextLocalOffset() {
        return localOffset++;
    }

    public int nextParamOffset() {
        return paramOffset++;
    }
}
