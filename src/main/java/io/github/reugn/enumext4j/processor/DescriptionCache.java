package io.github.reugn.enumext4j.processor;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers, per enum, the last description and the unit generated from it.
 *
 * <p>Entries are keyed by {@link EnumToGenerate#declaredQualifiedName()}. A description that
 * equals the one from the immediately preceding pass for the same enum reuses the previous unit,
 * so the emitter is not invoked again.
 *
 * <p>Changes made during a pass are staged and only become visible after {@link #commit()}.
 * A pass that is abandoned calls {@link #rollback()} instead, leaving the previous pass's entries
 * valid.
 *
 * <p>Not thread-safe; passes over the same program never run concurrently.
 */
final class DescriptionCache {

    private final Map<String, OutputUnit> committed = new HashMap<>();
    private final Map<String, OutputUnit> staged = new LinkedHashMap<>();
    private int hits;
    private int misses;

    /**
     * Finds the unit generated for an equal description in the previous pass.
     *
     * @param description the freshly extracted description
     * @return the previous unit marked {@link OutputUnit.Decision#REUSE}, or empty if the enum is
     * new or its description changed
     */
    Optional<OutputUnit> lookup(EnumToGenerate description) {
        OutputUnit previous = committed.get(description.declaredQualifiedName());
        if (previous != null && previous.description().equals(description)) {
            hits++;
            return Optional.of(previous.reused());
        }
        misses++;
        return Optional.empty();
    }

    /**
     * Resolves a description to a unit, emitting only on a cache miss, and stages the result.
     *
     * @param description the freshly extracted description
     * @param emitter     renders the description on a miss
     * @return the reused or newly emitted unit
     */
    OutputUnit resolve(EnumToGenerate description, ExtensionEmitter emitter) {
        OutputUnit unit = lookup(description).orElseGet(() -> new OutputUnit(
                description.unitName(), description, emitter.emit(description), OutputUnit.Decision.EMIT));
        staged.put(description.declaredQualifiedName(), unit);
        return unit;
    }

    /**
     * Replaces the previous pass's entries with the units staged in the current pass.
     *
     * <p>Enums absent from the current pass are forgotten, so they are emitted again when they
     * reappear.
     */
    void commit() {
        committed.clear();
        committed.putAll(staged);
        staged.clear();
    }

    /**
     * Discards the units staged in the current pass.
     */
    void rollback() {
        staged.clear();
    }

    int hits() {
        return hits;
    }

    int misses() {
        return misses;
    }

    int size() {
        return committed.size();
    }
}
