package org.pascalvm.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A scoped symbol table mapping identifiers (or mangled subprogram keys) to {@link SymbolEntry}s.
 * <p>
 * The root scope holds the globals and all subprogram entries. Every subprogram body is
 * generated inside a child scope that is opened with {@link #enterScope()} and discarded with
 * {@link #exitScope()}; entries defined there disappear with it. Lookups are case-insensitive
 * and search from the current scope upwards to the root.
 *
 * <p>Semantic analysis populates the root scope; the code generator only queries it and adds the
 * parameters and locals of the subprogram it is currently generating.</p>
 */
public class SymbolTable {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    /**
     * Represents a single lexical scope (a subprogram body or the global scope).
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, SymbolEntry> symbols = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        /**
         * @return The enclosing scope, or {@code null} for the global scope.
         */
        public Scope parent() {
            return parent;
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private int depth;

    /**
     * Constructs an empty symbol table positioned at the global scope.
     */
    public SymbolTable() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    // === Scope management ===

    /**
     * Enters a new, empty scope nested in the current one.
     * @return The new scope.
     */
    public Scope enterScope() {
        currentScope = new Scope(currentScope);
        depth++;
        log.debug("Entered scope at depth {}", depth);
        return currentScope;
    }

    /**
     * Leaves the current scope and discards all of its entries. Has no effect at the global scope.
     */
    public void exitScope() {
        if (currentScope.parent != null) {
            log.debug("Leaving scope at depth {} ({} entries discarded)", depth, currentScope.symbols.size());
            currentScope = currentScope.parent;
            depth--;
        }
    }

    /**
     * @return True if the current scope is the global scope.
     */
    public boolean isGlobalScope() {
        return currentScope == rootScope;
    }

    /**
     * Gets the current scope.
     * @return The current scope.
     */
    public Scope getCurrentScope() {
        return currentScope;
    }

    // === Symbol definition and resolution ===

    /**
     * Adds an entry to the current scope under its {@link SymbolEntry#key()}.
     *
     * @param entry The entry to add.
     * @throws IllegalArgumentException if the key is already defined in the current scope.
     */
    public void addSymbol(SymbolEntry entry) {
        String key = normalize(entry.key());
        if (currentScope.symbols.containsKey(key)) {
            throw new IllegalArgumentException("Symbol '" + entry.key() + "' is already defined in this scope.");
        }
        currentScope.symbols.put(key, entry);
    }

    /**
     * Resolves a name or mangled key, searching from the current scope upwards to the root.
     *
     * @param nameOrMangledKey The identifier or mangled subprogram key.
     * @return An optional containing the found entry, or empty if not found.
     */
    public Optional<SymbolEntry> lookupSymbol(String nameOrMangledKey) {
        String key = normalize(nameOrMangledKey);
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            SymbolEntry entry = scope.symbols.get(key);
            if (entry != null) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT);
    }
}
