package io.github.reugn.enumext4j.processor;

import io.github.reugn.enumext4j.annotation.EnumExtensions;
import io.github.reugn.enumext4j.annotation.EnumStorage;
import io.github.reugn.enumext4j.annotation.EnumValue;
import io.github.reugn.enumext4j.annotation.Flags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Marker Identity Tests")
class MarkerIdentityTest {

    @Test
    @DisplayName("Qualified names match the shipped annotations")
    void matchesShippedAnnotations() {
        assertThat(MarkerIdentity.of(EnumExtensions.class.getCanonicalName())).contains(MarkerIdentity.OPT_IN);
        assertThat(MarkerIdentity.of(Flags.class.getCanonicalName())).contains(MarkerIdentity.FLAGS);
        assertThat(MarkerIdentity.of(EnumValue.class.getCanonicalName())).contains(MarkerIdentity.VALUE);
        assertThat(MarkerIdentity.of(EnumStorage.class.getCanonicalName())).contains(MarkerIdentity.STORAGE);
    }

    @Test
    @DisplayName("Simple name alone or another package does not match")
    void rejectsLookAlikes() {
        assertThat(MarkerIdentity.of("EnumExtensions")).isEmpty();
        assertThat(MarkerIdentity.of("other.EnumExtensions")).isEmpty();
    }
}
