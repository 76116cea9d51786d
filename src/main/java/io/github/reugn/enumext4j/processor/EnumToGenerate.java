package io.github.reugn.enumext4j.processor;

import java.util.List;

/**
 * Normalized description of one opted-in enum, the sole input of code generation.
 *
 * <p>Holds only strings, primitives and an immutable member list, never compiler elements or
 * trees. Two descriptions extracted from the same unchanged declaration in different passes are
 * therefore {@link #equals equal}, which is what {@link DescriptionCache} relies on to skip
 * regenerating output.
 *
 * @param outputName            simple name of the generated class
 * @param declaredQualifiedName canonical name of the source enum, e.g. {@code com.example.Outer.Status}
 * @param declaredPackage       package of the source enum; empty for the unnamed package
 * @param namespace             package of the generated class; empty for the unnamed package
 * @param isPublic              whether the enum is declared {@code public}
 * @param hasFlags              whether the enum carries {@code @Flags}
 * @param underlyingType        primitive keyword of the storage type, e.g. {@code "int"}
 * @param members               constants in declaration order
 */
record EnumToGenerate(
        String outputName,
        String declaredQualifiedName,
        String declaredPackage,
        String namespace,
        boolean isPublic,
        boolean hasFlags,
        String underlyingType,
        List<EnumMember> members) {

    /**
     * Suffix of every output unit name.
     */
    static final String UNIT_SUFFIX = "_EnumExtensions";

    EnumToGenerate {
        members = List.copyOf(members);
    }

    /**
     * Returns the name under which this description's output is dispatched.
     *
     * @return {@code {outputName}_EnumExtensions}
     */
    String unitName() {
        return outputName + UNIT_SUFFIX;
    }

    /**
     * Returns the qualified name of the generated class.
     *
     * @return {@code namespace.outputName}, or just {@code outputName} in the unnamed package
     */
    String outputQualifiedName() {
        return namespace.isEmpty() ? outputName : namespace + "." + outputName;
    }

    /**
     * Returns the enum's simple names from the outermost type inwards.
     *
     * <p>For {@code com.example.Outer.Status} in package {@code com.example} this is
     * {@code [Outer, Status]}.
     *
     * @return the nesting chain of simple names
     */
    List<String> declaredSimpleNames() {
        String relative = declaredPackage.isEmpty()
                ? declaredQualifiedName
                : declaredQualifiedName.substring(declaredPackage.length() + 1);
        return List.of(relative.split("\\."));
    }

    /**
     * Checks whether the member values are exactly {@code 0..N-1} in declaration order.
     *
     * @return {@code true} if a value can be used directly as an index into the constants
     */
    boolean isContiguousFromZero() {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).value() != i) {
                return false;
            }
        }
        return !members.isEmpty();
    }
}
