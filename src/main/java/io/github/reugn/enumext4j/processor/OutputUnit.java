package io.github.reugn.enumext4j.processor;

import com.squareup.javapoet.JavaFile;

/**
 * One generated source file together with the description it was generated from.
 *
 * @param name        unit name, {@code {outputName}_EnumExtensions}
 * @param description the description the file was rendered from
 * @param file        the rendered source
 * @param decision    whether the file was rendered in this pass or reused from a previous one
 */
record OutputUnit(String name, EnumToGenerate description, JavaFile file, Decision decision) {

    /**
     * Re-emission decision for a unit.
     */
    enum Decision {
        /**
         * The description is new or changed; the file was rendered in this pass.
         */
        EMIT,
        /**
         * The description equals the previous pass's; the previous file is reused.
         */
        REUSE
    }

    /**
     * Returns a copy of this unit marked as reused.
     *
     * @return the same unit with {@link Decision#REUSE}
     */
    OutputUnit reused() {
        return new OutputUnit(name, description, file, Decision.REUSE);
    }
}
