package org.pascalvm.compiler.config;

import com.typesafe.config.Config;

/**
 * Options of the code generator, read from the {@code pascalvm.codegen} block.
 *
 * @param resetLabelsPerUnit Restart label numbering at every {@code generateCode} call. When false the
 *                           counter keeps running across runs of the same generator.
 * @param traceInstructions  Log every emitted line at TRACE level.
 * @param mainLabel          The label that marks the start of the main block.
 */
public record CodeGenOptions(boolean resetLabelsPerUnit, boolean traceInstructions, String mainLabel) {

    public static final String CONFIG_PATH = "pascalvm.codegen";

    /**
     * @return The built-in defaults, identical to those in {@code reference.conf}.
     */
    public static CodeGenOptions defaults() {
        return new CodeGenOptions(true, false, "main_entry");
    }

    /**
     * Maps the {@code pascalvm.codegen} block of an application config.
     *
     * @param config The resolved application config.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if the block is missing or a value has the wrong type.
     */
    public static CodeGenOptions fromConfig(Config config) {
        Config codegen = config.getConfig(CONFIG_PATH);
        return new CodeGenOptions(
                codegen.getBoolean("labels.reset-per-unit"),
                codegen.getBoolean("trace-instructions"),
                codegen.getString("main-label"));
    }
}
