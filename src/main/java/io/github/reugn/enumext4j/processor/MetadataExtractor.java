package io.github.reugn.enumext4j.processor;

import com.sun.source.util.TreePath;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reduces a resolved enum declaration to an {@link EnumToGenerate}.
 *
 * <p>The result depends only on the declaration and its annotations, never on element identity,
 * so re-extracting an unchanged enum yields an equal description.
 *
 * <p><b>Extraction Steps:</b>
 * <ol>
 *   <li>Resolve the declared {@link TypeElement}; give up if it is missing or not an enum</li>
 *   <li>Default the output to {@code {EnumName}Extensions} in the enum's package</li>
 *   <li>Fold the enum's annotations through {@link MarkerSettings}: {@code @Flags},
 *       {@code @EnumExtensions} overrides and {@code @EnumStorage}</li>
 *   <li>Record whether the enum itself is declared {@code public}</li>
 *   <li>Collect enum constants in declaration order with their numeric values</li>
 * </ol>
 */
final class MetadataExtractor {

    private MetadataExtractor() {
    }

    /**
     * Extracts the description of one opted-in enum.
     *
     * @param candidate path to the enum declaration
     * @param symbols   the symbol table of the current pass
     * @return the description, or empty if the declared symbol cannot be resolved
     */
    static Optional<EnumToGenerate> extract(TreePath candidate, SymbolTable symbols) {
        return extract(symbols.getElement(candidate));
    }

    /**
     * Extracts the description of an already resolved declaration.
     *
     * @param element the declared element, may be {@code null}
     * @return the description, or empty if {@code element} is not an enum
     */
    static Optional<EnumToGenerate> extract(Element element) {
        if (!(element instanceof TypeElement enumType) || enumType.getKind() != ElementKind.ENUM) {
            return Optional.empty();
        }

        String packageName = packageName(enumType);
        MarkerSettings settings = MarkerSettings.defaults(enumType.getSimpleName().toString(), packageName);
        for (AnnotationMirror mirror : enumType.getAnnotationMirrors()) {
            settings = settings.apply(mirror);
        }

        return Optional.of(new EnumToGenerate(
                settings.outputName(),
                enumType.getQualifiedName().toString(),
                packageName,
                settings.namespace(),
                enumType.getModifiers().contains(Modifier.PUBLIC),
                settings.hasFlags(),
                settings.underlyingType(),
                collectMembers(enumType)));
    }

    /**
     * Collects the enum constants with their values.
     *
     * <p>A constant annotated with {@code @EnumValue} takes that value; any other constant takes
     * its predecessor's value plus one, starting at {@code 0}. Enclosed elements that are not
     * constants (fields, methods, constructors) are skipped.
     *
     * @param enumType the enum
     * @return members in declaration order
     */
    static List<EnumMember> collectMembers(TypeElement enumType) {
        List<EnumMember> members = new ArrayList<>();
        long next = 0;
        for (Element enclosed : enumType.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.ENUM_CONSTANT) {
                continue;
            }
            long value = explicitValue(enclosed).orElse(next);
            members.add(new EnumMember(enclosed.getSimpleName().toString(), value));
            next = value + 1;
        }
        return members;
    }

    /**
     * Reads the {@code @EnumValue} of a constant.
     *
     * @param constant an enum constant
     * @return the explicit value, or empty if the value is implicit
     */
    static OptionalLong explicitValue(Element constant) {
        for (AnnotationMirror mirror : constant.getAnnotationMirrors()) {
            if (MarkerIdentity.of(mirror).filter(MarkerIdentity.VALUE::equals).isEmpty()) {
                continue;
            }
            for (AnnotationValue value : mirror.getElementValues().values()) {
                if (value.getValue() instanceof Number number) {
                    return OptionalLong.of(number.longValue());
                }
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Returns the package of a type.
     *
     * @param type any type element
     * @return the qualified package name, or empty for the unnamed package
     */
    static String packageName(TypeElement type) {
        Element e = type;
        while (!(e instanceof PackageElement)) {
            e = e.getEnclosingElement();
        }
        PackageElement pkg = (PackageElement) e;
        return pkg.isUnnamed() ? "" : pkg.getQualifiedName().toString();
    }
}
