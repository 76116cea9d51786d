package io.github.reugn.enumext4j.processor;

import com.google.auto.service.AutoService;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.TreePath;
import com.sun.source.util.Trees;
import io.github.reugn.enumext4j.annotation.EnumExtensions;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Annotation processor for enumext4j: generates extension helper classes for enums.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by the
 * Java compiler.
 *
 * <p><b>Generated Output:</b>
 * <p>For each enum annotated with {@link EnumExtensions}, generates a utility class:
 * <pre>
 * {@code // Source
 * @EnumExtensions
 * public enum Status { OPEN, CLOSED }
 *
 * // Generated: StatusExtensions.java
 * public final class StatusExtensions {
 *     public static String toStringFast(Status value) { ... }
 *     public static int toValue(Status value) { ... }
 *     public static Status fromValue(int value) { ... }
 *     ...
 * }}
 * </pre>
 *
 * <p><b>Rounds:</b>
 * <p>Every processing round is one pass of the {@link ExtensionPipeline} over the compilation
 * units of the round's root types. The pipeline keeps a {@link DescriptionCache} across rounds;
 * each generated class is written to the {@link javax.annotation.processing.Filer} once per
 * compilation, with the enum as its originating element.
 *
 * <p><b>Error Handling:</b>
 * <p>Errors are reported via the {@link Messager} and processing continues, so a single
 * compilation reports as many problems as possible.
 *
 * @see ExtensionPipeline
 * @see ExtensionClassGenerator
 * @see ProcessorOptions
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.enumext4j.annotation.EnumExtensions",
        "io.github.reugn.enumext4j.annotation.Flags",
        "io.github.reugn.enumext4j.annotation.EnumValue",
        "io.github.reugn.enumext4j.annotation.EnumStorage"
})
@SupportedOptions({ProcessorOptions.VERBOSE, ProcessorOptions.GENERATED_ANNOTATION})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class EnumExtensionsProcessor extends AbstractProcessor {

    private final Set<String> writtenTypes = new HashSet<>();
    private final BooleanSupplier cancelled;
    private DiagnosticReporter reporter;
    private ExtensionPipeline pipeline;
    private Trees trees;

    /**
     * Creates a new EnumExtensionsProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}.
     */
    public EnumExtensionsProcessor() {
        this(() -> Thread.currentThread().isInterrupted());
    }

    /**
     * Creates a processor with a custom cancellation signal.
     *
     * @param cancelled polled between candidates; {@code true} abandons the current round
     */
    EnumExtensionsProcessor(BooleanSupplier cancelled) {
        this.cancelled = cancelled;
    }

    /**
     * Initializes the processor with the processing environment.
     *
     * <p>Reads {@link ProcessorOptions}, sets up the {@link DiagnosticReporter} and the
     * {@link ExtensionPipeline}, and obtains the {@link Trees} API. Outside {@code javac} the
     * Trees API may be unavailable; the processor then warns once and generates nothing.
     *
     * @param processingEnv the environment providing access to compiler facilities
     */
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        ProcessorOptions options = ProcessorOptions.from(processingEnv.getOptions());
        this.reporter = new MessagerReporter(processingEnv.getMessager(), options.verbose());
        this.pipeline = new ExtensionPipeline(new ExtensionClassGenerator(options.generatedAnnotation()), reporter);
        try {
            this.trees = Trees.instance(processingEnv);
        } catch (IllegalArgumentException e) {
            reporter.warning(null, "enumext4j requires the javac Trees API, no extensions will be generated: "
                    + e.getMessage());
        }
    }

    /**
     * Runs one pipeline pass over the round and writes the resulting classes.
     *
     * <p>A cancelled pass writes nothing; the pipeline keeps the previous pass's cache.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations, preventing other processors from handling them
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (trees == null) {
            return true;
        }

        ProgramSnapshot snapshot = new ProgramSnapshot(collectCompilationUnits(roundEnv), trees::getElement,
                cancelled);
        List<OutputUnit> units;
        try {
            units = pipeline.supply(snapshot);
        } catch (CancellationException e) {
            reporter.note("enumext4j pass cancelled, nothing generated in this round");
            return true;
        }
        for (OutputUnit unit : units) {
            write(unit);
        }
        return true;
    }

    /**
     * Collects the distinct compilation units that declare the round's root types.
     *
     * <p>Types loaded from class files have no tree and are skipped.
     *
     * @param roundEnv the round environment
     * @return compilation units in root element order
     */
    private List<CompilationUnitTree> collectCompilationUnits(RoundEnvironment roundEnv) {
        Set<CompilationUnitTree> units = new LinkedHashSet<>();
        for (Element root : roundEnv.getRootElements()) {
            if (!(root instanceof TypeElement)) {
                continue;
            }
            TreePath path = trees.getPath(root);
            if (path != null) {
                units.add(path.getCompilationUnit());
            }
        }
        return new ArrayList<>(units);
    }

    /**
     * Writes a unit's source file unless it was already written in this compilation.
     *
     * @param unit the unit to write
     */
    private void write(OutputUnit unit) {
        EnumToGenerate description = unit.description();
        String qualifiedName = description.outputQualifiedName();
        if (!writtenTypes.add(qualifiedName)) {
            reporter.note("Already written: " + qualifiedName + " (" + unit.name() + ")");
            return;
        }

        TypeElement origin = processingEnv.getElementUtils().getTypeElement(description.declaredQualifiedName());
        try {
            JavaFileObject file = origin != null
                    ? processingEnv.getFiler().createSourceFile(qualifiedName, origin)
                    : processingEnv.getFiler().createSourceFile(qualifiedName);
            try (Writer writer = file.openWriter()) {
                unit.file().writeTo(writer);
            }
            reporter.note("Generated " + qualifiedName + " (" + unit.name() + ", " + unit.decision() + ")");
        } catch (IOException e) {
            reporter.error(origin, "Failed to generate extensions class: " + e.getMessage());
        }
    }

    /**
     * Forwards diagnostics to the {@link Messager}; notes only in verbose mode.
     */
    private static final class MessagerReporter implements DiagnosticReporter {

        private final Messager messager;
        private final boolean verbose;

        MessagerReporter(Messager messager, boolean verbose) {
            this.messager = messager;
            this.verbose = verbose;
        }

        @Override
        public void error(Element element, String message) {
            messager.printMessage(Diagnostic.Kind.ERROR, message, element);
        }

        @Override
        public void warning(Element element, String message) {
            messager.printMessage(Diagnostic.Kind.WARNING, message, element);
        }

        @Override
        public void note(String message) {
            if (verbose) {
                messager.printMessage(Diagnostic.Kind.NOTE, message);
            }
        }
    }
}
