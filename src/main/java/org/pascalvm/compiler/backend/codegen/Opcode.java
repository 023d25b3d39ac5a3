package org.pascalvm.compiler.backend.codegen;

import java.util.Locale;

/**
 * The instructions of the target stack machine that the generator emits.
 * The mnemonic is the lower-case constant name.
 */
public enum Opcode {
    // program and control flow
    START, STOP, JUMP, JZ, PUSHA, CALL, RETURN,
    // stack management
    PUSHN, POP, SWAP,
    // frame and global slots
    PUSHG, PUSHL, STOREG, STOREL,
    // heap blocks
    ALLOC, LOAD, STORE, LOADN, STOREN,
    // constants and conversion
    PUSHI, PUSHF, PUSHS, ITOF,
    // integer arithmetic
    ADD, SUB, MUL, DIV,
    // real arithmetic
    FADD, FSUB, FMUL, FDIV,
    // comparison and logic
    EQUAL, NOT, INF, INFEQ, SUP, SUPEQ, FINF, FINFEQ, FSUP, FSUPEQ,
    // output
    WRITEI, WRITEF, WRITES;

    private final String mnemonic = name().toLowerCase(Locale.ROOT);

    public String mnemonic() {
        return mnemonic;
    }
}
