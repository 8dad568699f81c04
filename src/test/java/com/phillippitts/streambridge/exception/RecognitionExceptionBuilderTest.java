package com.phillippitts.streambridge.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionExceptionBuilderTest {

    @Test
    void shouldBuildPlainMessageWithoutDetails() {
        RecognitionException ex = RecognitionExceptionBuilder.create("Backend stream closed")
                .backend("websocket")
                .build();

        assertThat(ex.getMessage()).isEqualTo("Backend stream closed (backend: websocket)");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void shouldAppendDetailsInOrder() {
        IOException cause = new IOException("refused");

        RecognitionException ex = RecognitionExceptionBuilder.create("Connect failed")
                .backend("websocket")
                .segment(7)
                .durationMs(3000)
                .metadata("uri", "ws://asr:2700")
                .metadata("skipped", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Connect failed (segment=7, durationMs=3000, uri=ws://asr:2700) (backend: websocket)");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getBackendName()).isEqualTo("websocket");
    }

    @Test
    void shouldDefaultBackendToUnknown() {
        assertThat(RecognitionExceptionBuilder.create("x").build().getBackendName()).isEqualTo("unknown");
    }

    @Test
    void shouldRejectEmptyMessage() {
        assertThatThrownBy(() -> RecognitionExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
