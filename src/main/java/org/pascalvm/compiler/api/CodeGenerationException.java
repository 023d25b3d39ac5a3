package org.pascalvm.compiler.api;

/**
 * Thrown when code generation aborts. Generation either completes the whole traversal or
 * fails at the first violation; no partial output is produced.
 */
public class CodeGenerationException extends RuntimeException {

    private final CodeGenError error;

    /**
     * @param error   The kind of violation.
     * @param message A description naming the offending symbol or construct.
     */
    public CodeGenerationException(CodeGenError error, String message) {
        super("CodeGen: " + message);
        this.error = error;
    }

    /**
     * @return The kind of violation that aborted generation.
     */
    public CodeGenError getError() {
        return error;
    }
}
