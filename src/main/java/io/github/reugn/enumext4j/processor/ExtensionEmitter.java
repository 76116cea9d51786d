package io.github.reugn.enumext4j.processor;

import com.squareup.javapoet.JavaFile;

/**
 * Renders a description into a Java source file.
 */
@FunctionalInterface
interface ExtensionEmitter {
    /**
     * Renders the extensions class for one enum.
     *
     * @param description the enum description
     * @return the generated source file
     */
    JavaFile emit(EnumToGenerate description);
}
