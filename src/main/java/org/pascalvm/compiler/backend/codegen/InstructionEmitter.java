package org.pascalvm.compiler.backend.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends the textual program, one line per instruction or label.
 * <p>
 * Instruction lines are indented by four spaces and carry at most one operand separated by a
 * single space; label lines are the label followed by a colon. Every line ends with {@code \n}.
 * This is the only class that writes to the output buffer.
 */
public class InstructionEmitter {

    private static final Logger log = LoggerFactory.getLogger(InstructionEmitter.class);

    static final String INDENT = "    ";

    private final StringBuilder code = new StringBuilder();
    private final boolean trace;
    private int lineCount;

    /**
     * @param trace Log every emitted line at TRACE level.
     */
    public InstructionEmitter(boolean trace) {
        this.trace = trace;
    }

    public void emit(Opcode opcode) {
        appendLine(INDENT + opcode.mnemonic());
    }

    public void emit(Opcode opcode, String operand) {
        appendLine(INDENT + opcode.mnemonic() + " " + operand);
    }

    public void emit(Opcode opcode, int operand) {
        emit(opcode, Integer.toString(operand));
    }

    public void emitLabel(String label) {
        appendLine(label + ":");
    }

    /**
     * @return The number of lines emitted since the last {@link #reset()}.
     */
    public int lineCount() {
        return lineCount;
    }

    /**
     * Discards everything emitted so far.
     */
    public void reset() {
        code.setLength(0);
        lineCount = 0;
    }

    /**
     * @return The program text emitted so far.
     */
    public String build() {
        return code.toString();
    }

    private void appendLine(String line) {
        if (trace && log.isTraceEnabled()) {
            log.trace("{}: {}", lineCount, line);
        }
        code.append(line).append('\n');
        lineCount++;
    }
}
