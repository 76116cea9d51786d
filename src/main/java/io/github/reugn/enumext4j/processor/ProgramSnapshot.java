package io.github.reugn.enumext4j.processor;

import com.sun.source.tree.CompilationUnitTree;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * The input of one pass: the compilation units to scan and the symbols to resolve them against.
 *
 * <p>All candidates of a pass share this snapshot; nothing in it changes during the pass.
 *
 * @param compilationUnits the syntax trees of the pass
 * @param symbols          the symbol table of the same pass
 * @param cancelled        polled between candidates; {@code true} abandons the pass
 */
record ProgramSnapshot(List<CompilationUnitTree> compilationUnits, SymbolTable symbols,
                       BooleanSupplier cancelled) {

    ProgramSnapshot {
        compilationUnits = List.copyOf(compilationUnits);
    }

    /**
     * Creates a snapshot that is never cancelled.
     */
    ProgramSnapshot(List<CompilationUnitTree> compilationUnits, SymbolTable symbols) {
        this(compilationUnits, symbols, () -> false);
    }

    /**
     * Throws if cancellation was requested.
     *
     * @throws CancellationException if the pass should be abandoned
     */
    void throwIfCancelled() {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Enum extensions pass cancelled");
        }
    }
}
