package org.pascalvm.compiler.backend.codegen;

/**
 * Hands out unique control-flow labels of the form {@code L_<PREFIX>_<n>}.
 * The counter is shared by all prefixes and only ever increases until {@link #reset()}.
 */
public class LabelAllocator {

    public static final String ELSE = "ELSE";
    public static final String END_IF = "END_IF";
    public static final String WHILE_START = "WHILE_START";
    public static final String WHILE_END = "WHILE_END";

    private int counter;

    /**
     * @param prefix The construct the label belongs to, e.g. {@link #ELSE}.
     * @return A label not handed out before in this compilation unit.
     */
    public String newLabel(String prefix) {
        return "L_" + prefix + "_" + counter++;
    }

    public void reset() {
        counter = 0;
    }
}
