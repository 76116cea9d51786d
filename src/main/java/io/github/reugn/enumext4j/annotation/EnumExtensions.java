package io.github.reugn.enumext4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests a generated extensions class for the annotated enum.
 * <p>
 * The generated class holds static, reflection-free helpers for converting between constants,
 * their names and their numeric values:
 * <pre>
 * {@code
 * @EnumExtensions
 * public enum Status {
 *     OPEN,
 *     @EnumValue(5) CLOSED,
 *     ARCHIVED
 * }
 *
 * // Generated: StatusExtensions.java
 * StatusExtensions.toValue(Status.ARCHIVED);  // 6
 * StatusExtensions.fromValue(5);              // Status.CLOSED
 * StatusExtensions.toStringFast(Status.OPEN); // "OPEN"
 * StatusExtensions.tryParse("ARCHIVED");      // Optional[ARCHIVED]
 * }
 * </pre>
 * <p>
 * By default the class is named {@code {EnumName}Extensions} and placed in the enum's package.
 * Both can be overridden:
 * <pre>
 * {@code
 * @EnumExtensions(extensionClassName = "Statuses", extensionClassNamespace = "com.example.util")
 * public enum Status { OPEN, CLOSED }
 * }
 * </pre>
 *
 * @see Flags
 * @see EnumValue
 * @see EnumStorage
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface EnumExtensions {

    /**
     * Simple name of the generated class.
     * <p>
     * When omitted, the class is named {@code {EnumName}Extensions}. A value written explicitly
     * is used as is and must be a valid class name.
     *
     * @return the generated class name
     */
    String extensionClassName() default "";

    /**
     * Package of the generated class.
     * <p>
     * When omitted, the package of the annotated enum is used. An explicitly written
     * {@code ""} places the class in the unnamed package. Enums not visible outside their package
     * cannot be moved to another package.
     *
     * @return the generated class package
     */
    String extensionClassNamespace() default "";
}
