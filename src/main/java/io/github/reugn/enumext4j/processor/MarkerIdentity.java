package io.github.reugn.enumext4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import java.util.Optional;

/**
 * Annotation types recognized by the processor, identified by qualified name.
 *
 * <p>Recognition compares the qualified name of a resolved annotation type against these
 * constants. An annotation named {@code EnumExtensions} in any other package is not the marker.
 */
enum MarkerIdentity {
    OPT_IN("io.github.reugn.enumext4j.annotation.EnumExtensions"),
    FLAGS("io.github.reugn.enumext4j.annotation.Flags"),
    VALUE("io.github.reugn.enumext4j.annotation.EnumValue"),
    STORAGE("io.github.reugn.enumext4j.annotation.EnumStorage");

    private final String qualifiedName;

    MarkerIdentity(String qualifiedName) {
        this.qualifiedName = qualifiedName;
    }

    /**
     * Finds the identity with the given qualified name.
     *
     * @param qualifiedName a fully qualified annotation type name
     * @return the identity, or empty for unrelated annotations
     */
    static Optional<MarkerIdentity> of(CharSequence qualifiedName) {
        for (MarkerIdentity identity : values()) {
            if (identity.qualifiedName.contentEquals(qualifiedName)) {
                return Optional.of(identity);
            }
        }
        return Optional.empty();
    }

    /**
     * Identifies a resolved annotation type element.
     *
     * <p>Erroneous types (unresolved symbols) never match.
     *
     * @param element the resolved element, may be {@code null}
     * @return the identity, or empty if the element is absent, unresolved or unrelated
     */
    static Optional<MarkerIdentity> of(Element element) {
        if (!(element instanceof TypeElement type) || type.asType().getKind() == TypeKind.ERROR) {
            return Optional.empty();
        }
        return of(type.getQualifiedName());
    }

    /**
     * Identifies an annotation mirror by its annotation type.
     *
     * @param mirror the annotation mirror
     * @return the identity, or empty if unrelated
     */
    static Optional<MarkerIdentity> of(AnnotationMirror mirror) {
        return of(mirror.getAnnotationType().asElement());
    }
}
