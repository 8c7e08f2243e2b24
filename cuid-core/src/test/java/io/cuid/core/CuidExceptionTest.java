package io.cuid.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CuidExceptionTest {

    @Test
    void shouldConstructExceptionWithCauseOnly() {
        var cause = new IllegalStateException("root");

        var exception = new CuidException(cause);

        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void shouldConstructExceptionWithMessageAndCause() {
        var cause = new IllegalArgumentException("bad");

        var exception = new CuidException("boom", cause);

        assertThat(exception.getMessage()).isEqualTo("boom");
        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void shouldConstructExceptionWithMessageOnly() {
        var exception = new CuidException("only-message");

        assertThat(exception.getMessage()).isEqualTo("only-message");
        assertThat(exception.getCause()).isNull();
    }

    @Test
    void identifierGeneratorShouldBeFunctional() {
        IdGenerator<Long> generator = () -> 7L;

        assertThat(generator.generate()).isEqualTo(7L);
    }
}
