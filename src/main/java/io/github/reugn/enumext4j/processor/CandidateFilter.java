package io.github.reugn.enumext4j.processor;

import com.sun.source.tree.BlockTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.TreePath;
import com.sun.source.util.TreePathScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax-only selection of enum declarations that might request extensions.
 *
 * <p>Nothing here touches the symbol table, so it can run over every declaration of every
 * compilation unit in a round. An enum with any annotation at all is a candidate; whether one of
 * the annotations is really {@code @EnumExtensions} is decided by {@link SemanticResolver}.
 *
 * <p><b>Scanned scopes:</b>
 * <ul>
 *   <li>Top-level enums and enums nested in classes, interfaces, records and enums</li>
 *   <li>Not method bodies, initializer blocks or field initializers: enums declared there are
 *       local or anonymous-class members that generated code cannot reference</li>
 * </ul>
 */
final class CandidateFilter {

    private CandidateFilter() {
    }

    /**
     * Checks whether a node is an enum declaration carrying at least one annotation.
     *
     * @param node any syntax node
     * @return {@code true} for annotated enum declarations
     */
    static boolean isSyntaxTarget(Tree node) {
        return node.getKind() == Tree.Kind.ENUM
                && !((ClassTree) node).getModifiers().getAnnotations().isEmpty();
    }

    /**
     * Collects the paths of all syntactic candidates in a compilation unit, in source order.
     *
     * @param compilationUnit the unit to scan
     * @return candidate paths; empty if the unit declares no annotated enum
     */
    static List<TreePath> collect(CompilationUnitTree compilationUnit) {
        List<TreePath> candidates = new ArrayList<>();
        new CandidateScanner().scan(new TreePath(compilationUnit), candidates);
        return candidates;
    }

    private static final class CandidateScanner extends TreePathScanner<Void, List<TreePath>> {

        @Override
        public Void visitClass(ClassTree node, List<TreePath> candidates) {
            if (isSyntaxTarget(node)) {
                candidates.add(getCurrentPath());
            }
            return super.visitClass(node, candidates);
        }

        @Override
        public Void visitMethod(MethodTree node, List<TreePath> candidates) {
            return null;
        }

        @Override
        public Void visitVariable(VariableTree node, List<TreePath> candidates) {
            return null;
        }

        @Override
        public Void visitBlock(BlockTree node, List<TreePath> candidates) {
            return null;
        }
    }
}
