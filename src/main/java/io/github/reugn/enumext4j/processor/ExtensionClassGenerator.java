package io.github.reugn.enumext4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.reugn.enumext4j.processor.CodeGenUtils.VALUE_PARAM;
import static io.github.reugn.enumext4j.processor.CodeGenUtils.enumClassName;
import static io.github.reugn.enumext4j.processor.CodeGenUtils.firstByValue;
import static io.github.reugn.enumext4j.processor.CodeGenUtils.isSwitchable;
import static io.github.reugn.enumext4j.processor.CodeGenUtils.literal;
import static io.github.reugn.enumext4j.processor.CodeGenUtils.storageTypeName;

/**
 * Generates the {@code {EnumName}Extensions} class for an {@link EnumToGenerate}.
 *
 * <p><b>Generated Class Structure:</b>
 * <pre>
 * {@code @Generated("io.github.reugn.enumext4j.processor.EnumExtensionsProcessor")
 * public final class StatusExtensions {
 *     public static final int LENGTH = 3;
 *
 *     private StatusExtensions() { throw new UnsupportedOperationException("Utility class"); }
 *
 *     public static String toStringFast(Status value) { ... }
 *     public static int toValue(Status value) { ... }
 *     public static Status fromValue(int value) { ... }
 *     public static boolean isDefined(int value) { ... }
 *     public static boolean isDefined(String name) { ... }
 *     public static Optional<Status> tryParse(String name) { ... }
 *     public static Optional<Status> tryParse(String name, boolean ignoreCase) { ... }
 *     public static List<Status> getValues() { ... }
 *     public static List<String> getNames() { ... }
 *
 *     // @Flags enums only
 *     public static boolean hasFlag(int value, Status flag) { ... }
 *     public static int combine(Status... flags) { ... }
 *     public static EnumSet<Status> flagsOf(int value) { ... }
 * }}
 * </pre>
 *
 * <p>Lookups by value use direct array indexing when the values are {@code 0..N-1} in
 * declaration order, a {@code switch} otherwise, and {@code if} chains for {@code long} storage.
 */
final class ExtensionClassGenerator implements ExtensionEmitter {

    private static final ClassName GENERATED = ClassName.get("javax.annotation.processing", "Generated");
    private static final String VALUES_FIELD = "VALUES";
    private static final String LENGTH_FIELD = "LENGTH";

    private final boolean generatedAnnotation;

    /**
     * Creates a generator.
     *
     * @param generatedAnnotation whether to annotate generated classes with {@code @Generated}
     */
    ExtensionClassGenerator(boolean generatedAnnotation) {
        this.generatedAnnotation = generatedAnnotation;
    }

    @Override
    public JavaFile emit(EnumToGenerate description) {
        ClassName enumType = enumClassName(description);
        TypeName storage = storageTypeName(description.underlyingType());

        TypeSpec.Builder type = TypeSpec.classBuilder(description.outputName());
        if (description.isPublic()) {
            type.addModifiers(Modifier.PUBLIC);
        }
        type.addModifiers(Modifier.FINAL)
                .addJavadoc("Extension helpers for {@link $T}.\n", enumType)
                .addJavadoc("<p>Generated by enumext4j annotation processor.\n");
        if (generatedAnnotation) {
            type.addAnnotation(AnnotationSpec.builder(GENERATED)
                    .addMember("value", "$S", EnumExtensionsProcessor.class.getCanonicalName())
                    .build());
        }

        type.addFields(generateFields(description, enumType))
                .addMethod(MethodSpec.constructorBuilder()
                        .addModifiers(Modifier.PRIVATE)
                        .addStatement("throw new $T($S)", UnsupportedOperationException.class, "Utility class")
                        .build())
                .addMethod(generateToStringFast(description, enumType))
                .addMethod(generateToValue(description, enumType, storage))
                .addMethod(generateFromValue(description, enumType, storage))
                .addMethod(MethodSpec.methodBuilder("isDefined")
                        .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                        .returns(TypeName.BOOLEAN)
                        .addParameter(storage, VALUE_PARAM)
                        .addStatement("return fromValue($N) != null", VALUE_PARAM)
                        .addJavadoc("Checks whether a constant with the given value exists.\n")
                        .build())
                .addMethod(generateIsDefinedName(description))
                .addMethod(generateTryParse(description, enumType))
                .addMethod(generateTryParseIgnoreCase(enumType))
                .addMethod(MethodSpec.methodBuilder("getValues")
                        .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                        .returns(ParameterizedTypeName.get(ClassName.get(List.class), enumType))
                        .addStatement("return VALUE_LIST")
                        .addJavadoc("Returns all constants in declaration order.\n")
                        .build())
                .addMethod(MethodSpec.methodBuilder("getNames")
                        .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                        .returns(ParameterizedTypeName.get(List.class, String.class))
                        .addStatement("return NAME_LIST")
                        .addJavadoc("Returns all constant names in declaration order.\n")
                        .build());

        if (description.hasFlags()) {
            type.addMethods(generateFlagMethods(enumType, storage, description.underlyingType()));
        }

        return JavaFile.builder(description.namespace(), type.build())
                .addFileComment("Generated by enumext4j annotation processor. Do not modify.")
                .build();
    }

    // ==================== FIELDS ====================

    private List<FieldSpec> generateFields(EnumToGenerate description, ClassName enumType) {
        CodeBlock constants = description.members().stream()
                .map(member -> CodeBlock.of("$T.$L", enumType, member.name()))
                .collect(CodeBlock.joining(", "));
        CodeBlock names = description.members().stream()
                .map(member -> CodeBlock.of("$S", member.name()))
                .collect(CodeBlock.joining(", "));
        return List.of(
                FieldSpec.builder(TypeName.INT, LENGTH_FIELD, Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$L", description.members().size())
                        .addJavadoc("Number of constants.\n")
                        .build(),
                FieldSpec.builder(ArrayTypeName.of(enumType), VALUES_FIELD,
                                Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$T.values()", enumType)
                        .build(),
                FieldSpec.builder(ParameterizedTypeName.get(ClassName.get(List.class), enumType), "VALUE_LIST",
                                Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$T.of($L)", List.class, constants)
                        .build(),
                FieldSpec.builder(ParameterizedTypeName.get(List.class, String.class), "NAME_LIST",
                                Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$T.of($L)", List.class, names)
                        .build());
    }

    // ==================== CONVERSIONS ====================

    private MethodSpec generateToStringFast(EnumToGenerate description, ClassName enumType) {
        CodeBlock.Builder body = CodeBlock.builder().beginControlFlow("switch ($N)", VALUE_PARAM);
        for (EnumMember member : description.members()) {
            body.add("case $L:\n", member.name()).indent()
                    .addStatement("return $S", member.name())
                    .unindent();
        }
        body.endControlFlow().addStatement("return $N.name()", VALUE_PARAM);

        return MethodSpec.methodBuilder("toStringFast")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(String.class)
                .addParameter(enumType, VALUE_PARAM)
                .addCode(body.build())
                .addJavadoc("Returns the name of a constant without reflection.\n")
                .build();
    }

    private MethodSpec generateToValue(EnumToGenerate description, ClassName enumType, TypeName storage) {
        CodeBlock.Builder body = CodeBlock.builder().beginControlFlow("switch ($N)", VALUE_PARAM);
        for (EnumMember member : description.members()) {
            body.add("case $L:\n", member.name()).indent()
                    .addStatement("return $L", literal(member.value(), description.underlyingType()))
                    .unindent();
        }
        body.endControlFlow()
                .addStatement("throw new $T($S + $N)", IllegalArgumentException.class, "Unknown constant: ",
                        VALUE_PARAM);

        return MethodSpec.methodBuilder("toValue")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(storage)
                .addParameter(enumType, VALUE_PARAM)
                .addCode(body.build())
                .addJavadoc("Returns the numeric value of a constant.\n")
                .build();
    }

    private MethodSpec generateFromValue(EnumToGenerate description, ClassName enumType, TypeName storage) {
        String keyword = description.underlyingType();
        CodeBlock.Builder body = CodeBlock.builder();

        if (description.isContiguousFromZero()) {
            body.beginControlFlow("if ($N >= 0 && $N < $N)", VALUE_PARAM, VALUE_PARAM, LENGTH_FIELD)
                    .addStatement("return $N[(int) $N]", VALUES_FIELD, VALUE_PARAM)
                    .endControlFlow();
        } else if (isSwitchable(keyword)) {
            body.beginControlFlow("switch ($N)", VALUE_PARAM);
            for (Map.Entry<Long, EnumMember> entry : firstByValue(description.members()).entrySet()) {
                body.add("case $L:\n", literal(entry.getKey(), keyword)).indent()
                        .addStatement("return $T.$L", enumType, entry.getValue().name())
                        .unindent();
            }
            body.endControlFlow();
        } else {
            for (Map.Entry<Long, EnumMember> entry : firstByValue(description.members()).entrySet()) {
                body.beginControlFlow("if ($N == $L)", VALUE_PARAM, literal(entry.getKey(), keyword))
                        .addStatement("return $T.$L", enumType, entry.getValue().name())
                        .endControlFlow();
            }
        }
        body.addStatement("return null");

        return MethodSpec.methodBuilder("fromValue")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(enumType)
                .addParameter(storage, VALUE_PARAM)
                .addCode(body.build())
                .addJavadoc("Returns the first declared constant with the given value, or {@code null} if none.\n")
                .build();
    }

    // ==================== PARSING ====================

    private MethodSpec generateIsDefinedName(EnumToGenerate description) {
        CodeBlock.Builder body = CodeBlock.builder()
                .beginControlFlow("if (name == null)")
                .addStatement("return false")
                .endControlFlow()
                .beginControlFlow("switch (name)");
        for (EnumMember member : description.members()) {
            body.add("case $S:\n", member.name()).indent()
                    .addStatement("return true")
                    .unindent();
        }
        body.endControlFlow().addStatement("return false");

        return MethodSpec.methodBuilder("isDefined")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(TypeName.BOOLEAN)
                .addParameter(String.class, "name")
                .addCode(body.build())
                .addJavadoc("Checks whether a constant with the given name exists.\n")
                .build();
    }

    private MethodSpec generateTryParse(EnumToGenerate description, ClassName enumType) {
        CodeBlock.Builder body = CodeBlock.builder()
                .beginControlFlow("if (name == null)")
                .addStatement("return $T.empty()", Optional.class)
                .endControlFlow()
                .beginControlFlow("switch (name)");
        for (EnumMember member : description.members()) {
            body.add("case $S:\n", member.name()).indent()
                    .addStatement("return $T.of($T.$L)", Optional.class, enumType, member.name())
                    .unindent();
        }
        body.endControlFlow().addStatement("return $T.empty()", Optional.class);

        return MethodSpec.methodBuilder("tryParse")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(ParameterizedTypeName.get(ClassName.get(Optional.class), enumType))
                .addParameter(String.class, "name")
                .addCode(body.build())
                .addJavadoc("Finds the constant with the given name, matching case exactly.\n")
                .build();
    }

    private MethodSpec generateTryParseIgnoreCase(ClassName enumType) {
        return MethodSpec.methodBuilder("tryParse")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(ParameterizedTypeName.get(ClassName.get(Optional.class), enumType))
                .addParameter(String.class, "name")
                .addParameter(TypeName.BOOLEAN, "ignoreCase")
                .beginControlFlow("if (!ignoreCase)")
                .addStatement("return tryParse(name)")
                .endControlFlow()
                .beginControlFlow("if (name == null)")
                .addStatement("return $T.empty()", Optional.class)
                .endControlFlow()
                .beginControlFlow("for ($T candidate : $N)", enumType, VALUES_FIELD)
                .beginControlFlow("if (candidate.name().equalsIgnoreCase(name))")
                .addStatement("return $T.of(candidate)", Optional.class)
                .endControlFlow()
                .endControlFlow()
                .addStatement("return $T.empty()", Optional.class)
                .addJavadoc("Finds the constant with the given name, optionally ignoring case.\n")
                .build();
    }

    // ==================== FLAGS ====================

    private List<MethodSpec> generateFlagMethods(ClassName enumType, TypeName storage, String keyword) {
        MethodSpec hasFlag = MethodSpec.methodBuilder("hasFlag")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(TypeName.BOOLEAN)
                .addParameter(storage, VALUE_PARAM)
                .addParameter(enumType, "flag")
                .addStatement("$T bits = toValue(flag)", storage)
                .addStatement("return ($N & bits) == bits", VALUE_PARAM)
                .addJavadoc("Checks whether all bits of {@code flag} are set in {@code value}.\n")
                .build();

        MethodSpec.Builder combine = MethodSpec.methodBuilder("combine")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(storage)
                .addParameter(ArrayTypeName.of(enumType), "flags")
                .varargs()
                .addStatement("long result = 0L")
                .beginControlFlow("for ($T flag : flags)", enumType)
                .addStatement("result |= toValue(flag)")
                .endControlFlow()
                .addJavadoc("Combines flags into a single value.\n");
        if (isSwitchable(keyword)) {
            combine.addStatement("return ($T) result", storage);
        } else {
            combine.addStatement("return result");
        }

        TypeName setType = ParameterizedTypeName.get(ClassName.get(EnumSet.class), enumType);
        MethodSpec flagsOf = MethodSpec.methodBuilder("flagsOf")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(setType)
                .addParameter(storage, VALUE_PARAM)
                .addStatement("$T result = $T.noneOf($T.class)", setType, EnumSet.class, enumType)
                .beginControlFlow("for ($T flag : $N)", enumType, VALUES_FIELD)
                .beginControlFlow("if (toValue(flag) != 0 && hasFlag($N, flag))", VALUE_PARAM)
                .addStatement("result.add(flag)")
                .endControlFlow()
                .endControlFlow()
                .addStatement("return result")
                .addJavadoc("Returns the non-zero flags whose bits are all set in {@code value}.\n")
                .build();

        return List.of(hasFlag, combine.build(), flagsOf);
    }
}
