package dev.univer.collector.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizeUtilTest {

    @Test
    void usernameGetsSingleMarker() {
        assertThat(NormalizeUtil.normalizeUsername("durov")).isEqualTo("@durov");
        assertThat(NormalizeUtil.normalizeUsername("@durov")).isEqualTo("@durov");
        assertThat(NormalizeUtil.normalizeUsername("  durov ")).isEqualTo("@durov");
    }

    @Test
    void missingUsernameStaysMissing() {
        assertThat(NormalizeUtil.normalizeUsername(null)).isNull();
        assertThat(NormalizeUtil.normalizeUsername("")).isNull();
        assertThat(NormalizeUtil.normalizeUsername("   ")).isNull();
        assertThat(NormalizeUtil.normalizeUsername("@")).isNull();
    }

    @Test
    void chatLabelFallsBackToId() {
        assertThat(NormalizeUtil.chatLabel("Books", -5)).isEqualTo("Books (-5)");
        assertThat(NormalizeUtil.chatLabel(" ", -5)).isEqualTo("-5");
        assertThat(NormalizeUtil.chatLabel(null, -5)).isEqualTo("-5");
    }

    @Test
    void describeReportsRootCause() {
        Exception wrapped = new IllegalStateException("outer", new UncheckedIOException(new IOException("disk full")));

        assertThat(NormalizeUtil.describe(wrapped)).isEqualTo("disk full");
        assertThat(NormalizeUtil.describe(new NullPointerException())).isEqualTo("NullPointerException");
    }
}
