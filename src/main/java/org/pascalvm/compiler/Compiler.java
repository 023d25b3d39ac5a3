package org.pascalvm.compiler;

import org.pascalvm.compiler.api.CodeGenerationException;
import org.pascalvm.compiler.backend.codegen.CodeGenerator;
import org.pascalvm.compiler.config.CodeGenOptions;
import org.pascalvm.compiler.config.ConfigLoader;
import org.pascalvm.compiler.frontend.parser.ast.ProgramNode;
import org.pascalvm.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Entry point of the backend. Takes the output of the front end (a type-checked AST and the
 * populated symbol table) and produces the stack-machine program text.
 * <p>
 * One {@link Compiler} keeps one {@link CodeGenerator}, so with
 * {@code pascalvm.codegen.labels.reset-per-unit = false} label numbers keep increasing across
 * the units it compiles.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CodeGenerator generator;

    /**
     * Creates a compiler configured from the classpath defaults, system properties and environment.
     */
    public Compiler() {
        this(ConfigLoader.loadDefaults());
    }

    /**
     * @param config The resolved application config containing a {@code pascalvm.codegen} block.
     */
    public Compiler(Config config) {
        this(CodeGenOptions.fromConfig(config));
    }

    public Compiler(CodeGenOptions options) {
        this.generator = new CodeGenerator(options);
    }

    /**
     * Generates code for one compilation unit.
     *
     * @param program     The type-checked program.
     * @param symbolTable The symbol table populated by semantic analysis.
     * @return The program text.
     * @throws CodeGenerationException if the AST violates the generator's input contract.
     */
    public String compile(ProgramNode program, SymbolTable symbolTable) {
        long start = System.nanoTime();
        try {
            String code = generator.generateCode(program, symbolTable);
            if (log.isInfoEnabled()) {
                log.info("Generated {} lines for program '{}' in {} ms",
                        generator.emittedLineCount(), program.name(), (System.nanoTime() - start) / 1_000_000);
            }
            return code;
        } catch (CodeGenerationException e) {
            log.error("Code generation for program '{}' failed ({}): {}", program.name(), e.getError(), e.getMessage());
            throw e;
        }
    }
}
