package io.github.reugn.enumext4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an enum whose values are combined as independent bits rather than used as
 * exclusive states.
 * <p>
 * Together with {@link EnumExtensions}, adds {@code hasFlag}, {@code combine} and
 * {@code flagsOf} helpers to the generated class:
 * <pre>
 * {@code
 * @Flags
 * @EnumExtensions
 * public enum Permission {
 *     @EnumValue(1) READ,
 *     @EnumValue(2) WRITE,
 *     @EnumValue(4) EXECUTE
 * }
 *
 * int mask = PermissionExtensions.combine(Permission.READ, Permission.WRITE); // 3
 * PermissionExtensions.hasFlag(mask, Permission.WRITE);                      // true
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface Flags {
}
