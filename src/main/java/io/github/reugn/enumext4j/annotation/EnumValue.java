package io.github.reugn.enumext4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Assigns an explicit numeric value to an enum constant.
 * <p>
 * Constants without this annotation take the value of the preceding constant plus one;
 * the first constant defaults to {@code 0}:
 * <pre>
 * {@code
 * @EnumExtensions
 * public enum Level {
 *     LOW,                // 0
 *     @EnumValue(5) MID,  // 5
 *     HIGH                // 6
 * }
 * }
 * </pre>
 * The value must fit in the enum's {@link EnumStorage storage type}.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.SOURCE)
public @interface EnumValue {

    /**
     * The constant's numeric value.
     *
     * @return the value
     */
    long value();
}
