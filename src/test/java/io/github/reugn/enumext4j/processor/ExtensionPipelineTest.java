package io.github.reugn.enumext4j.processor;

import com.google.testing.compile.JavaFileObjects;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Extension Pipeline Tests")
class ExtensionPipelineTest {

    private static final JavaFileObject STATUS = JavaFileObjects.forSourceString("test.Status",
            """
                    package test;
                    
                    import io.github.reugn.enumext4j.annotation.EnumExtensions;
                    
                    @EnumExtensions
                    public enum Status { OPEN, CLOSED }
                    """);

    private static final JavaFileObject LEVEL = JavaFileObjects.forSourceString("test.Level",
            """
                    package test;
                    
                    import io.github.reugn.enumext4j.annotation.EnumExtensions;
                    
                    @EnumExtensions
                    public enum Level { LOW, HIGH }
                    """);

    private RecordingReporter reporter;
    private ExtensionPipeline pipeline;

    @BeforeEach
    void setUp() {
        reporter = new RecordingReporter();
        pipeline = new ExtensionPipeline(new ExtensionClassGenerator(true), reporter);
    }

    private List<OutputUnit> supply(JavaFileObject... sources) {
        return PipelineHarness.run(round -> pipeline.supply(round.snapshot()), sources);
    }

    @Nested
    @DisplayName("Pass Results")
    class PassResults {

        @Test
        @DisplayName("No candidates yields no units and no diagnostics")
        void noCandidates() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Service",
                    """
                            package test;
                            
                            public class Service {
                                enum Plain { A }
                            }
                            """);

            assertThat(supply(source)).isEmpty();
            assertThat(reporter.errors).isEmpty();
            assertThat(reporter.warnings).isEmpty();
            assertThat(reporter.notes).isEmpty();
        }

        @Test
        @DisplayName("One unit per opted-in enum, named {outputName}_EnumExtensions")
        void unitPerEnum() {
            List<OutputUnit> units = supply(STATUS, LEVEL);

            assertThat(units).extracting(OutputUnit::name)
                    .containsExactlyInAnyOrder("StatusExtensions_EnumExtensions", "LevelExtensions_EnumExtensions");
            assertThat(units).allSatisfy(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.EMIT));
            assertThat(reporter.notes).anySatisfy(note -> assertThat(note).contains("enumext4j pass"));
        }

        @Test
        @DisplayName("Compilation unit supplied twice produces one unit per enum")
        void duplicateUnitsCoalesce() {
            List<OutputUnit> units = PipelineHarness.run(round -> {
                List<CompilationUnitTree> twice = List.of(round.units().get(0), round.units().get(0));
                return pipeline.supply(new ProgramSnapshot(twice, round.symbols()));
            }, STATUS);

            assertThat(units).hasSize(1);
            assertThat(reporter.errors).isEmpty();
        }

        @Test
        @DisplayName("Two enums targeting the same generated class are a conflict")
        void outputConflict() {
            JavaFileObject first = JavaFileObjects.forSourceString("a.Color",
                    """
                            package a;
                            
                            import io.github.reugn.enumext4j.annotation.EnumExtensions;
                            
                            @EnumExtensions(extensionClassName = "Shared", extensionClassNamespace = "gen")
                            public enum Color { RED }
                            """);
            JavaFileObject second = JavaFileObjects.forSourceString("b.Shape",
                    """
                            package b;
                            
                            import io.github.reugn.enumext4j.annotation.EnumExtensions;
                            
                            @EnumExtensions(extensionClassName = "Shared", extensionClassNamespace = "gen")
                            public enum Shape { CIRCLE }
                            """);

            List<OutputUnit> units = supply(first, second);

            assertThat(units).hasSize(1);
            assertThat(reporter.errors).singleElement().asString()
                    .contains("gen.Shared")
                    .contains("conflicts with the one generated for");
        }
    }

    @Nested
    @DisplayName("Incremental Reuse")
    class IncrementalReuse {

        @Test
        @DisplayName("Second pass over the same trees reuses every unit")
        void secondPassReuses() {
            List<List<OutputUnit>> passes = PipelineHarness.run(
                    round -> List.of(pipeline.supply(round.snapshot()), pipeline.supply(round.snapshot())),
                    STATUS, LEVEL);

            assertThat(passes.get(1)).allSatisfy(unit ->
                    assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.REUSE));
            assertThat(passes.get(1)).extracting(OutputUnit::description)
                    .containsExactlyElementsOf(passes.get(0).stream().map(OutputUnit::description).toList());
        }

        @Test
        @DisplayName("Recompiling unchanged sources reuses the previous units")
        void recompilationReuses() {
            List<OutputUnit> first = supply(STATUS);
            List<OutputUnit> second = supply(STATUS);

            assertThat(first).singleElement()
                    .satisfies(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.EMIT));
            assertThat(second).singleElement()
                    .satisfies(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.REUSE));
            assertThat(second.get(0).file()).isSameAs(first.get(0).file());
            assertThat(pipeline.cache().hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("Changed declaration is emitted again")
        void changedDeclarationEmits() {
            JavaFileObject changed = JavaFileObjects.forSourceString("test.Status",
                    """
                            package test;
                            
                            import io.github.reugn.enumext4j.annotation.EnumExtensions;
                            
                            @EnumExtensions
                            public enum Status { OPEN, CLOSED, ARCHIVED }
                            """);

            supply(STATUS);
            List<OutputUnit> second = supply(changed);

            assertThat(second).singleElement()
                    .satisfies(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.EMIT));
            assertThat(pipeline.cache().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Enum that skipped a pass is emitted again")
        void reappearingEnumEmits() {
            supply(STATUS, LEVEL);
            supply(STATUS);
            List<OutputUnit> third = supply(STATUS, LEVEL);

            assertThat(third).filteredOn(unit -> unit.name().equals("StatusExtensions_EnumExtensions"))
                    .singleElement()
                    .satisfies(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.REUSE));
            assertThat(third).filteredOn(unit -> unit.name().equals("LevelExtensions_EnumExtensions"))
                    .singleElement()
                    .satisfies(unit -> assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.EMIT));
            assertThat(pipeline.cache().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unresolvable declared symbol is skipped with a warning")
        void unresolvedDeclaration() {
            JavaFileObject broken = JavaFileObjects.forSourceString("test.Broken",
                    """
                            package test;
                            
                            import io.github.reugn.enumext4j.annotation.EnumExtensions;
                            
                            @EnumExtensions
                            public enum Broken { A }
                            """);

            List<OutputUnit> units = PipelineHarness.run(round -> {
                SymbolTable symbols = path -> path.getLeaf() instanceof ClassTree declaration
                        && declaration.getSimpleName().contentEquals("Broken")
                        ? null
                        : round.trees().getElement(path);
                return pipeline.supply(new ProgramSnapshot(round.units(), symbols));
            }, broken, STATUS);

            assertThat(units).extracting(OutputUnit::name).containsExactly("StatusExtensions_EnumExtensions");
            assertThat(reporter.warnings).singleElement().asString()
                    .contains("Skipping @EnumExtensions on enum Broken");
            assertThat(reporter.errors).isEmpty();
        }

        @Test
        @DisplayName("Cancellation throws and leaves an empty cache empty")
        void cancellationOnFirstPass() {
            Boolean cancelled = PipelineHarness.run(round -> {
                ProgramSnapshot snapshot = new ProgramSnapshot(round.units(), round.symbols(), () -> true);
                try {
                    pipeline.supply(snapshot);
                    return false;
                } catch (CancellationException e) {
                    return true;
                }
            }, STATUS);

            assertThat(cancelled).isTrue();
            assertThat(pipeline.cache().size()).isZero();
        }

        @Test
        @DisplayName("Cancellation mid-pass keeps the previous pass's cache")
        void cancellationKeepsPreviousPass() {
            AtomicInteger polls = new AtomicInteger();
            List<OutputUnit> afterCancel = PipelineHarness.run(round -> {
                pipeline.supply(round.snapshot());
                try {
                    pipeline.supply(new ProgramSnapshot(round.units(), round.symbols(),
                            () -> polls.incrementAndGet() > 3));
                    throw new AssertionError("Pass was not cancelled");
                } catch (CancellationException expected) {
                    // continue with a clean pass
                }
                return pipeline.supply(round.snapshot());
            }, STATUS, LEVEL);

            assertThat(pipeline.cache().size()).isEqualTo(2);
            assertThat(afterCancel).allSatisfy(unit ->
                    assertThat(unit.decision()).isEqualTo(OutputUnit.Decision.REUSE));
        }
    }
}
