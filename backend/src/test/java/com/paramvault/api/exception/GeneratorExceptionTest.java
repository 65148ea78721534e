package com.paramvault.api.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GeneratorException")
class GeneratorExceptionTest {

    @Test
    @DisplayName("should append captured stderr to the message")
    void shouldAppendStderr() {
        GeneratorStartupException ex = new GeneratorStartupException(
                "Generator exited before signalling readiness", "error while loading shared libraries\n");

        assertThat(ex.getMessage())
                .isEqualTo("Generator exited before signalling readiness (stderr: error while loading shared libraries)");
        assertThat(ex.getStderr()).isEqualTo("error while loading shared libraries\n");
    }

    @Test
    @DisplayName("should keep the plain message when stderr is empty")
    void shouldKeepPlainMessage() {
        IOException cause = new IOException("Broken pipe");
        GeneratorIpcException ex = new GeneratorIpcException("Error communicating with generator", null, cause);

        assertThat(ex.getMessage()).isEqualTo("Error communicating with generator");
        assertThat(ex.getStderr()).isEmpty();
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
