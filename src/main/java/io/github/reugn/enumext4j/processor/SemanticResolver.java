package io.github.reugn.enumext4j.processor;

import com.sun.source.tree.AnnotationTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.TreePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Confirms syntactic candidates against the symbol table.
 *
 * <p>A candidate is kept only if one of its annotations resolves to
 * {@link MarkerIdentity#OPT_IN}. Matching is by qualified name, so an unrelated annotation that
 * happens to be called {@code EnumExtensions} is rejected. Annotations that do not resolve are
 * skipped: partially broken sources must not abort the round.
 */
final class SemanticResolver {

    private SemanticResolver() {
    }

    /**
     * Resolves the annotations of a single candidate.
     *
     * @param candidate path to an annotated enum declaration
     * @param symbols   the symbol table of the current pass
     * @return the same candidate if it carries the opt-in marker, otherwise empty
     */
    static Optional<TreePath> resolve(TreePath candidate, SymbolTable symbols) {
        ClassTree declaration = (ClassTree) candidate.getLeaf();
        TreePath modifiers = new TreePath(candidate, declaration.getModifiers());

        for (AnnotationTree annotation : declaration.getModifiers().getAnnotations()) {
            TreePath annotationPath = new TreePath(modifiers, annotation);
            TreePath typePath = new TreePath(annotationPath, annotation.getAnnotationType());
            Optional<MarkerIdentity> identity = MarkerIdentity.of(symbols.getElement(typePath));
            if (identity.filter(MarkerIdentity.OPT_IN::equals).isPresent()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Deduplicates candidates by syntax node and resolves each distinct one.
     *
     * <p>The same declaration can be reached more than once (e.g. when a compilation unit is
     * supplied twice); it is resolved and returned only once, in first-seen order.
     *
     * @param candidates syntactic candidates of the pass
     * @param symbols    the symbol table of the current pass
     * @return the opted-in candidates
     */
    static List<TreePath> resolveAll(List<TreePath> candidates, SymbolTable symbols) {
        Set<Tree> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<TreePath> resolved = new ArrayList<>();
        for (TreePath candidate : candidates) {
            if (seen.add(candidate.getLeaf())) {
                resolve(candidate, symbols).ifPresent(resolved::add);
            }
        }
        return resolved;
    }
}
