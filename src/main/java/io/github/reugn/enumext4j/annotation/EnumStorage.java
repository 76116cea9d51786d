package io.github.reugn.enumext4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the primitive type that stores an enum's numeric values in generated code.
 * <p>
 * Enums without this annotation use {@code int}.
 * <pre>
 * {@code
 * @EnumExtensions
 * @EnumStorage(StorageType.LONG)
 * public enum Limit {
 *     @EnumValue(4_000_000_000L) LARGE
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface EnumStorage {

    /**
     * The storage type.
     *
     * @return the storage type
     */
    StorageType value();
}
