/**
 * Annotations that opt enums into generated extension helpers.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.enumext4j.annotation.EnumExtensions} - Generate an extensions class for an enum</li>
 *   <li>{@link io.github.reugn.enumext4j.annotation.Flags} - Treat the enum's values as combinable bits</li>
 *   <li>{@link io.github.reugn.enumext4j.annotation.EnumValue} - Give a constant an explicit numeric value</li>
 *   <li>{@link io.github.reugn.enumext4j.annotation.EnumStorage} - Choose the primitive type holding the values</li>
 * </ul>
 * <p>
 * All annotations are processed by {@link io.github.reugn.enumext4j.processor.EnumExtensionsProcessor},
 * generating one {@code {EnumName}Extensions} class per annotated enum.
 *
 * @see io.github.reugn.enumext4j.processor.EnumExtensionsProcessor
 */
package io.github.reugn.enumext4j.annotation;
