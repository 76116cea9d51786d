package io.github.reugn.enumext4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;
import io.github.reugn.enumext4j.annotation.StorageType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared utilities for generating extension classes.
 *
 * <p><b>Literal Examples:</b>
 * <p>Shows how member values are written for each storage type.
 * <ul>
 *   <li>{@code int} 42 → 42</li>
 *   <li>{@code long} 42 → 42L</li>
 *   <li>{@code byte} -1 → (byte) -1</li>
 *   <li>{@code short} 300 → (short) 300</li>
 * </ul>
 *
 * @see ExtensionClassGenerator
 */
final class CodeGenUtils {

    /**
     * Parameter name for the enum constant or numeric value passed to generated helpers.
     */
    static final String VALUE_PARAM = "value";

    private CodeGenUtils() {
    }

    /**
     * Resolves a storage keyword to a JavaPoet type.
     *
     * @param keyword one of {@code byte}, {@code short}, {@code int}, {@code long}
     * @return the primitive type name
     * @throws IllegalArgumentException if the keyword is not a storage type
     */
    static TypeName storageTypeName(String keyword) {
        return switch (keyword) {
            case "byte" -> TypeName.BYTE;
            case "short" -> TypeName.SHORT;
            case "int" -> TypeName.INT;
            case "long" -> TypeName.LONG;
            default -> throw new IllegalArgumentException("Unsupported storage type: " + keyword);
        };
    }

    /**
     * Writes a value as a constant expression of the storage type.
     *
     * @param value   the value
     * @param keyword the storage type keyword
     * @return a Java expression usable as a return value and as a {@code case} label
     */
    static String literal(long value, String keyword) {
        return switch (keyword) {
            case "long" -> value + "L";
            case "byte", "short" -> "(" + keyword + ") " + value;
            default -> Long.toString(value);
        };
    }

    /**
     * Checks whether values of this storage type can be used as a {@code switch} selector.
     *
     * @param keyword the storage type keyword
     * @return {@code false} for {@code long}
     */
    static boolean isSwitchable(String keyword) {
        return !StorageType.LONG.keyword().equals(keyword);
    }

    /**
     * Maps each distinct value to the first member declaring it.
     *
     * <p>Several constants may share a value; lookups by value resolve to the earliest one.
     *
     * @param members members in declaration order
     * @return value to member, in declaration order of first occurrence
     */
    static Map<Long, EnumMember> firstByValue(List<EnumMember> members) {
        Map<Long, EnumMember> result = new LinkedHashMap<>();
        for (EnumMember member : members) {
            result.putIfAbsent(member.value(), member);
        }
        return result;
    }

    /**
     * Builds the class name of the source enum, including enclosing types.
     *
     * @param description the enum description
     * @return the enum's class name
     */
    static ClassName enumClassName(EnumToGenerate description) {
        List<String> names = description.declaredSimpleNames();
        return ClassName.get(description.declaredPackage(), names.get(0),
                names.subList(1, names.size()).toArray(new String[0]));
    }
}
