package io.github.reugn.enumext4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static com.google.testing.compile.Compiler.javac;

@DisplayName("Processor Cancellation Tests")
class ProcessorCancellationTest {

    private static final JavaFileObject STATUS = JavaFileObjects.forSourceString("test.Status",
            """
                    package test;
                    
                    import io.github.reugn.enumext4j.annotation.EnumExtensions;
                    
                    @EnumExtensions
                    public enum Status { OPEN, CLOSED }
                    
                    @EnumExtensions
                    enum Level { LOW, HIGH }
                    """);

    @Test
    @DisplayName("Cancelled round compiles cleanly and writes nothing")
    void cancelledRound() {
        Compilation compilation = javac()
                .withProcessors(new EnumExtensionsProcessor(() -> true))
                .withOptions("-Aenumext4j.verbose=true")
                .compile(STATUS);

        assertThat(compilation).succeeded();
        assertThat(compilation).hadNoteContaining("enumext4j pass cancelled");
        Assertions.assertThat(compilation.generatedSourceFiles()).isEmpty();
    }

    @Test
    @DisplayName("Cancellation after the first candidate discards the whole round")
    void cancelledMidRound() {
        AtomicInteger polls = new AtomicInteger();
        Compilation compilation = javac()
                .withProcessors(new EnumExtensionsProcessor(() -> polls.incrementAndGet() > 1))
                .compile(STATUS);

        assertThat(compilation).succeeded();
        Assertions.assertThat(compilation.generatedSourceFiles()).isEmpty();
    }

    @Test
    @DisplayName("Uncancelled processor generates as usual")
    void notCancelled() {
        Compilation compilation = javac()
                .withProcessors(new EnumExtensionsProcessor(() -> false))
                .compile(STATUS);

        assertThat(compilation).succeeded();
        assertThat(compilation).generatedSourceFile("test.StatusExtensions");
        assertThat(compilation).generatedSourceFile("test.LevelExtensions");
    }
}
