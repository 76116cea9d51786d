package io.github.reugn.enumext4j.processor;

import io.github.reugn.enumext4j.annotation.StorageType;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.VariableElement;
import java.util.Map;

/**
 * Enum-level settings folded from the enum's annotations.
 *
 * <p>Starts from the defaults and applies each annotation mirror in declaration order; every
 * step returns a new instance. For {@code @EnumExtensions}, only members written explicitly in
 * source are applied, in the order they were written, so a later occurrence of the same member
 * overwrites an earlier one. Members left at their default are not written and keep the
 * defaults; an explicitly written empty namespace selects the unnamed package.
 *
 * @param outputName     generated class name
 * @param namespace      generated class package
 * @param hasFlags       whether {@code @Flags} was seen
 * @param underlyingType storage type keyword
 */
record MarkerSettings(String outputName, String namespace, boolean hasFlags, String underlyingType) {

    static final String NAME_MEMBER = "extensionClassName";
    static final String NAMESPACE_MEMBER = "extensionClassNamespace";
    static final String OUTPUT_NAME_SUFFIX = "Extensions";

    /**
     * Returns the settings of an enum with no relevant annotations.
     *
     * @param enumName    the enum's simple name
     * @param packageName the enum's package, empty for the unnamed package
     * @return {@code {enumName}Extensions} in the enum's package, no flags, {@code int} storage
     */
    static MarkerSettings defaults(String enumName, String packageName) {
        return new MarkerSettings(enumName + OUTPUT_NAME_SUFFIX, packageName, false,
                StorageType.INT.keyword());
    }

    /**
     * Applies one annotation.
     *
     * @param mirror an annotation present on the enum
     * @return the updated settings; {@code this} for unrelated annotations
     */
    MarkerSettings apply(AnnotationMirror mirror) {
        return MarkerIdentity.of(mirror)
                .map(identity -> switch (identity) {
                    case FLAGS -> new MarkerSettings(outputName, namespace, true, underlyingType);
                    case OPT_IN -> applyOptions(mirror);
                    case STORAGE -> applyStorage(mirror);
                    case VALUE -> this;
                })
                .orElse(this);
    }

    private MarkerSettings applyOptions(AnnotationMirror mirror) {
        MarkerSettings result = this;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                : mirror.getElementValues().entrySet()) {
            if (!(entry.getValue().getValue() instanceof String value)) {
                continue;
            }
            String member = entry.getKey().getSimpleName().toString();
            if (NAME_MEMBER.equals(member)) {
                result = new MarkerSettings(value, result.namespace, result.hasFlags, result.underlyingType);
            } else if (NAMESPACE_MEMBER.equals(member)) {
                result = new MarkerSettings(result.outputName, value, result.hasFlags, result.underlyingType);
            }
        }
        return result;
    }

    private MarkerSettings applyStorage(AnnotationMirror mirror) {
        for (AnnotationValue value : mirror.getElementValues().values()) {
            if (value.getValue() instanceof VariableElement constant) {
                String keyword = StorageType.valueOf(constant.getSimpleName().toString()).keyword();
                return new MarkerSettings(outputName, namespace, hasFlags, keyword);
            }
        }
        return this;
    }
}
