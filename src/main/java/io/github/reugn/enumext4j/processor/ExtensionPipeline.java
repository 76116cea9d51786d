package io.github.reugn.enumext4j.processor;

import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.TreePath;

import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs one pass from syntax trees to output units.
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Filter</b>: {@link CandidateFilter} selects annotated enum declarations</li>
 *   <li><b>Resolve</b>: {@link SemanticResolver} deduplicates them and keeps those carrying
 *       {@code @EnumExtensions}</li>
 *   <li><b>Extract</b>: {@link MetadataExtractor} builds one {@link EnumToGenerate} per enum;
 *       {@link ValidationUtils} rejects invalid configurations</li>
 *   <li><b>Coalesce</b>: equal descriptions collapse into one; different descriptions targeting
 *       the same generated class are reported as a conflict</li>
 *   <li><b>Dispatch</b>: {@link DescriptionCache} reuses the previous unit of an unchanged enum or
 *       invokes the {@link ExtensionEmitter}</li>
 * </ol>
 *
 * <p><b>Error Handling:</b>
 * <p>No failure aborts a pass. An enum whose declared symbol cannot be resolved is skipped with a
 * warning; invalid configurations are reported as errors and dropped. Cancellation is checked
 * between candidates and surfaces as {@link CancellationException}; the cache then keeps the
 * previous pass's state.
 *
 * <p>Only the cache survives between passes.
 */
final class ExtensionPipeline {

    private final ExtensionEmitter emitter;
    private final DiagnosticReporter reporter;
    private final DescriptionCache cache = new DescriptionCache();

    /**
     * Creates a pipeline.
     *
     * @param emitter  renders descriptions into source files
     * @param reporter receives skip warnings, validation errors and pass notes
     */
    ExtensionPipeline(ExtensionEmitter emitter, DiagnosticReporter reporter) {
        this.emitter = emitter;
        this.reporter = reporter;
    }

    /**
     * Runs a pass over a program snapshot.
     *
     * @param snapshot the syntax trees and symbols of this pass
     * @return one unit per generated class; empty if nothing is opted in
     * @throws CancellationException if the snapshot requests cancellation mid-pass
     */
    List<OutputUnit> supply(ProgramSnapshot snapshot) {
        List<TreePath> candidates = new ArrayList<>();
        for (CompilationUnitTree compilationUnit : snapshot.compilationUnits()) {
            candidates.addAll(CandidateFilter.collect(compilationUnit));
        }
        List<TreePath> resolved = SemanticResolver.resolveAll(candidates, snapshot.symbols());
        if (resolved.isEmpty()) {
            return List.of();
        }

        try {
            Map<String, EnumToGenerate> descriptions = extractAll(resolved, snapshot);
            List<OutputUnit> units = new ArrayList<>(descriptions.size());
            for (EnumToGenerate description : descriptions.values()) {
                snapshot.throwIfCancelled();
                units.add(cache.resolve(description, emitter));
            }
            cache.commit();

            reporter.note(String.format("enumext4j pass: %d candidates, %d opted in, %d units, %d reused",
                    candidates.size(), resolved.size(), units.size(),
                    units.stream().filter(u -> u.decision() == OutputUnit.Decision.REUSE).count()));
            return List.copyOf(units);
        } catch (CancellationException e) {
            cache.rollback();
            throw e;
        }
    }

    /**
     * Extracts and validates descriptions, keyed by generated class name.
     *
     * @param resolved opted-in candidates
     * @param snapshot the current pass
     * @return valid descriptions in candidate order
     */
    private Map<String, EnumToGenerate> extractAll(List<TreePath> resolved, ProgramSnapshot snapshot) {
        Map<String, EnumToGenerate> descriptions = new LinkedHashMap<>();
        for (TreePath candidate : resolved) {
            snapshot.throwIfCancelled();

            Element element = snapshot.symbols().getElement(candidate);
            Optional<EnumToGenerate> extracted = MetadataExtractor.extract(element);
            if (extracted.isEmpty()) {
                reporter.warning(element, "Skipping @EnumExtensions on enum "
                        + ((ClassTree) candidate.getLeaf()).getSimpleName()
                        + ": its declared symbol could not be resolved");
                continue;
            }

            EnumToGenerate description = extracted.get();
            if (!ValidationUtils.validate(description, (TypeElement) element, reporter)) {
                continue;
            }

            EnumToGenerate existing = descriptions.putIfAbsent(description.outputQualifiedName(), description);
            if (existing != null && !existing.equals(description)) {
                reporter.error(element, "Generated class " + description.outputQualifiedName()
                        + " for " + description.declaredQualifiedName() + " conflicts with the one generated for "
                        + existing.declaredQualifiedName() + ". Use extensionClassName to choose a distinct name.");
            }
        }
        return descriptions;
    }

    /**
     * Returns the cache, for inspection.
     *
     * @return the description cache
     */
    DescriptionCache cache() {
        return cache;
    }
}
