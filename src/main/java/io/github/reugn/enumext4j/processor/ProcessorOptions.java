package io.github.reugn.enumext4j.processor;

import java.util.Map;

/**
 * Annotation processor options, passed as {@code -A<key>=<value>}.
 *
 * <table border="1">
 *   <caption>Supported options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr>
 *     <td>{@code enumext4j.verbose}</td>
 *     <td>{@code false}</td>
 *     <td>Print a note for every pass and every generated class</td>
 *   </tr>
 *   <tr>
 *     <td>{@code enumext4j.generatedAnnotation}</td>
 *     <td>{@code true}</td>
 *     <td>Annotate generated classes with {@code @javax.annotation.processing.Generated}</td>
 *   </tr>
 * </table>
 *
 * @param verbose             whether notes are printed
 * @param generatedAnnotation whether generated classes carry {@code @Generated}
 */
record ProcessorOptions(boolean verbose, boolean generatedAnnotation) {

    static final String VERBOSE = "enumext4j.verbose";
    static final String GENERATED_ANNOTATION = "enumext4j.generatedAnnotation";

    /**
     * Parses options from the processing environment.
     *
     * @param options the raw {@code -A} options
     * @return the parsed options
     */
    static ProcessorOptions from(Map<String, String> options) {
        return new ProcessorOptions(
                flag(options, VERBOSE, false),
                flag(options, GENERATED_ANNOTATION, true));
    }

    // -Akey without a value enables the flag
    private static boolean flag(Map<String, String> options, String key, boolean defaultValue) {
        if (!options.containsKey(key)) {
            return defaultValue;
        }
        String value = options.get(key);
        return value == null || Boolean.parseBoolean(value);
    }
}
