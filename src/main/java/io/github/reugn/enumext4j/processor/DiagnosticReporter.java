package io.github.reugn.enumext4j.processor;

import javax.lang.model.element.Element;

/**
 * Interface for reporting compilation diagnostics.
 */
interface DiagnosticReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element where the error occurred, or {@code null}
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a warning on the given element.
     *
     * @param element the element the warning refers to, or {@code null}
     * @param message the warning message
     */
    void warning(Element element, String message);

    /**
     * Reports an informational note. Only shown in verbose mode.
     *
     * @param message the note
     */
    void note(String message);
}
