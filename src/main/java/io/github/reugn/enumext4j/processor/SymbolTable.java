package io.github.reugn.enumext4j.processor;

import com.sun.source.util.TreePath;

import javax.lang.model.element.Element;

/**
 * Read-only view of the compiler's symbols for one pass.
 *
 * <p>In {@code javac} this is backed by {@link com.sun.source.util.Trees#getElement(TreePath)}.
 */
@FunctionalInterface
interface SymbolTable {
    /**
     * Resolves the element a tree path refers to.
     *
     * @param path the path to a declaration or a name reference
     * @return the element, or {@code null} if it cannot be resolved
     */
    Element getElement(TreePath path);
}
