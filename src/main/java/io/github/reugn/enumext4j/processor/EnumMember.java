package io.github.reugn.enumext4j.processor;

/**
 * One enum constant and its numeric value.
 *
 * @param name  the constant name
 * @param value the constant's value, explicit or implied by its predecessor
 */
record EnumMember(String name, long value) {
}
