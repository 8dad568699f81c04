package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.exception.ControlMessageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlMessageParserTest {

    @Test
    void shouldParseStartRecordingWithTopLevelFields() {
        ControlMessage msg = ControlMessageParser.parse(
                "{\"type\":\"start_recording\",\"sample_rate\":16000,\"enable_partials\":false,"
                        + "\"hotwords\":[\"Kubernetes\",\"  \",\" gRPC \"],\"language_code\":\"de-DE\"}");

        assertThat(msg.type()).isEqualTo(ControlMessage.Type.START_RECORDING);
        assertThat(msg.sampleRate()).isEqualTo(16000);
        assertThat(msg.enablePartials()).isFalse();
        assertThat(msg.hotwords()).containsExactly("Kubernetes", "gRPC");
        assertThat(msg.languageCode()).isEqualTo("de-DE");
    }

    @Test
    void shouldPreferNestedConfigOverTopLevel() {
        ControlMessage msg = ControlMessageParser.parse(
                "{\"type\":\"start_recording\",\"sample_rate\":8000,\"config\":{\"sample_rate\":16000}}");

        assertThat(msg.sampleRate()).isEqualTo(16000);
    }

    @Test
    void shouldLeaveOmittedStartFieldsNull() {
        ControlMessage msg = ControlMessageParser.parse("{\"type\":\"start_recording\"}");

        assertThat(msg.sampleRate()).isNull();
        assertThat(msg.enablePartials()).isNull();
        assertThat(msg.languageCode()).isNull();
        assertThat(msg.hotwords()).isEmpty();
    }

    @Test
    void shouldParseConfigure() {
        ControlMessage msg = ControlMessageParser.parse(
                "{\"type\":\"configure\",\"config\":{\"vad_threshold\":0.05,\"silence_duration\":1.5}}");

        assertThat(msg.type()).isEqualTo(ControlMessage.Type.CONFIGURE);
        assertThat(msg.vadThreshold()).isEqualTo(0.05);
        assertThat(msg.silenceDuration()).isEqualTo(1.5);
    }

    @Test
    void shouldParseMessagesWithoutPayload() {
        assertThat(ControlMessageParser.parse("{\"type\":\"stop_recording\"}").type())
                .isEqualTo(ControlMessage.Type.STOP_RECORDING);
        assertThat(ControlMessageParser.parse("{\"type\":\"ping\"}").type())
                .isEqualTo(ControlMessage.Type.PING);
        assertThat(ControlMessageParser.parse("{\"type\":\"get_metrics\"}").type())
                .isEqualTo(ControlMessage.Type.GET_METRICS);
    }

    @Test
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> ControlMessageParser.parse("{\"type\":\"rewind\"}"))
                .isInstanceOf(ControlMessageException.class)
                .hasMessageContaining("Unknown message type");
    }

    @Test
    void shouldRejectMissingType() {
        assertThatThrownBy(() -> ControlMessageParser.parse("{\"sample_rate\":16000}"))
                .isInstanceOf(ControlMessageException.class)
                .hasMessageContaining("without type");
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> ControlMessageParser.parse("{\"type\":"))
                .isInstanceOf(ControlMessageException.class)
                .hasMessageStartingWith("Invalid JSON");
        assertThatThrownBy(() -> ControlMessageParser.parse("  "))
                .isInstanceOf(ControlMessageException.class);
    }

    @Test
    void shouldRejectWronglyTypedField() {
        assertThatThrownBy(() -> ControlMessageParser.parse(
                "{\"type\":\"start_recording\",\"sample_rate\":\"fast\"}"))
                .isInstanceOf(ControlMessageException.class)
                .hasMessageContaining("start_recording");
    }
}
