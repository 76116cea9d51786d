package io.github.reugn.enumext4j.processor;

import io.github.reugn.enumext4j.annotation.StorageType;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;

/**
 * Compile-time validation of extracted descriptions.
 *
 * <p>Catches configurations that would otherwise produce generated code that fails to compile,
 * and reports them on the enum with an actionable message. Every check runs, so a single
 * compilation reports all problems of an enum.
 *
 * <p><b>Checks:</b>
 * <ul>
 *   <li>{@code extensionClassName} must be a Java identifier</li>
 *   <li>{@code extensionClassNamespace} must be a package name</li>
 *   <li>Enums in the unnamed package cannot be referenced from a named package</li>
 *   <li>Enums not visible outside their package (non-public, or nested in a non-public type)
 *       keep their extensions in their own package</li>
 *   <li>Private enums, or enums nested in private types, are not supported</li>
 *   <li>The generated class must not replace the enum itself</li>
 *   <li>Every constant value must fit in the storage type</li>
 *   <li>An implicit value must not overflow {@code long}</li>
 * </ul>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: extensionClassName '1Ext' is not a valid Java class name
 * error: Enum Status is not public; its extensions cannot be generated in package other
 * error: Value 300 of Level.HIGH does not fit in byte
 * </pre>
 */
final class ValidationUtils {

    private ValidationUtils() {
    }

    /**
     * Validates a description against the enum it was extracted from.
     *
     * @param description   the extracted description
     * @param enumType      the enum
     * @param errorReporter receives one error per failed check
     * @return {@code true} if generation can proceed
     */
    static boolean validate(EnumToGenerate description, TypeElement enumType, DiagnosticReporter errorReporter) {
        boolean valid = validateOutputName(description, enumType, errorReporter);
        valid &= validateNamespace(description, enumType, errorReporter);
        valid &= validateAccessibility(description, enumType, errorReporter);
        valid &= validateValues(description, enumType, errorReporter);
        return valid;
    }

    private static boolean validateOutputName(EnumToGenerate description, TypeElement enumType,
                                              DiagnosticReporter errorReporter) {
        String name = description.outputName();
        if (!SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
            errorReporter.error(enumType, "extensionClassName '" + name + "' is not a valid Java class name");
            return false;
        }
        if (description.outputQualifiedName().equals(description.declaredQualifiedName())) {
            errorReporter.error(enumType, "Generated class " + description.outputQualifiedName()
                    + " would replace the enum itself. Choose a different extensionClassName.");
            return false;
        }
        return true;
    }

    private static boolean validateNamespace(EnumToGenerate description, TypeElement enumType,
                                             DiagnosticReporter errorReporter) {
        String namespace = description.namespace();
        if (!namespace.isEmpty() && !SourceVersion.isName(namespace)) {
            errorReporter.error(enumType, "extensionClassNamespace '" + namespace + "' is not a valid package name");
            return false;
        }
        if (description.declaredPackage().isEmpty() && !namespace.isEmpty()) {
            errorReporter.error(enumType, "Enum " + enumType.getSimpleName()
                    + " is in the unnamed package and cannot be referenced from package " + namespace);
            return false;
        }
        return true;
    }

    private static boolean validateAccessibility(EnumToGenerate description, TypeElement enumType,
                                                 DiagnosticReporter errorReporter) {
        for (Element e = enumType; e instanceof TypeElement; e = e.getEnclosingElement()) {
            if (e.getModifiers().contains(Modifier.PRIVATE)) {
                errorReporter.error(enumType, "Enum " + enumType.getSimpleName() + " is not accessible: "
                        + e.getSimpleName() + " is private. Generated extensions cannot access private types.");
                return false;
            }
        }
        if (description.namespace().equals(description.declaredPackage())) {
            return true;
        }
        for (Element e = enumType; e instanceof TypeElement; e = e.getEnclosingElement()) {
            if (e.getModifiers().contains(Modifier.PUBLIC)) {
                continue;
            }
            String reason = e == enumType ? "is not public" : "is nested in non-public type " + e.getSimpleName();
            errorReporter.error(enumType, "Enum " + enumType.getSimpleName() + " " + reason
                    + "; its extensions cannot be generated in package " + description.namespace());
            return false;
        }
        return true;
    }

    private static boolean validateValues(EnumToGenerate description, TypeElement enumType,
                                          DiagnosticReporter errorReporter) {
        StorageType storage = StorageType.fromKeyword(description.underlyingType());
        if (storage == null) {
            errorReporter.error(enumType, "Unsupported storage type: " + description.underlyingType());
            return false;
        }
        boolean valid = validateImplicitValues(description, enumType, errorReporter);
        for (EnumMember member : description.members()) {
            if (!storage.fits(member.value())) {
                errorReporter.error(enumType, "Value " + member.value() + " of " + enumType.getSimpleName()
                        + "." + member.name() + " does not fit in " + storage.keyword());
                valid = false;
            }
        }
        return valid;
    }

    private static boolean validateImplicitValues(EnumToGenerate description, TypeElement enumType,
                                                  DiagnosticReporter errorReporter) {
        boolean valid = true;
        int index = 0;
        for (Element enclosed : enumType.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.ENUM_CONSTANT) {
                continue;
            }
            if (index > 0
                    && description.members().get(index - 1).value() == Long.MAX_VALUE
                    && MetadataExtractor.explicitValue(enclosed).isEmpty()) {
                errorReporter.error(enumType, "Implicit value of " + enumType.getSimpleName() + "."
                        + enclosed.getSimpleName() + " overflows long. Give it an explicit @EnumValue.");
                valid = false;
            }
            index++;
        }
        return valid;
    }
}
