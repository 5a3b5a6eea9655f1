package com.eainde.amqpretry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionRetryabilityCheckerTest {

    @Test
    void everythingIsRetryableByDefault() {
        ExceptionRetryabilityChecker checker = ExceptionRetryabilityChecker.retryEverything();

        assertThat(checker.isRetryable(new IllegalStateException("boom"))).isTrue();
        assertThat(checker.isRetryable(new IOException("io"))).isTrue();
        assertThat(checker.isRetryable(null)).isTrue();
    }

    @Test
    void nonRetryableListMatchesSubclasses() {
        ExceptionRetryabilityChecker checker = new ExceptionRetryabilityChecker(
                List.of("java.lang.IllegalArgumentException"), List.of());

        assertThat(checker.isRetryable(new NumberFormatException("x"))).isFalse();
        assertThat(checker.isRetryable(new IllegalStateException("x"))).isTrue();
    }

    @Test
    void retryableListActsAsWhitelist() {
        ExceptionRetryabilityChecker checker = new ExceptionRetryabilityChecker(
                List.of(), List.of("java.io.IOException", "java.io.UncheckedIOException"));

        assertThat(checker.isRetryable(new IOException("x"))).isTrue();
        assertThat(checker.isRetryable(new UncheckedIOException(new IOException("x")))).isTrue();
        assertThat(checker.isRetryable(new IllegalStateException("x"))).isFalse();
    }

    @Test
    void nonRetryableWinsOverRetryable() {
        ExceptionRetryabilityChecker checker = new ExceptionRetryabilityChecker(
                List.of("java.io.FileNotFoundException"), List.of("java.io.IOException"));

        assertThat(checker.isRetryable(new java.io.FileNotFoundException("x"))).isFalse();
        assertThat(checker.isRetryable(new IOException("x"))).isTrue();
    }

    @Test
    void unknownClassNamesAreIgnored() {
        ExceptionRetryabilityChecker checker = new ExceptionRetryabilityChecker(
                List.of("com.example.DoesNotExist"), null);

        assertThat(checker.isRetryable(new IllegalStateException("x"))).isTrue();
    }
}
