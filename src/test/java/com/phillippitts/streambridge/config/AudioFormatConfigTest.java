package com.phillippitts.streambridge.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;

class AudioFormatConfigTest {

    @Test
    void shouldAcceptRequiredFormatConstants() {
        assertThatCode(() -> new AudioFormatConfig().validateAudioFormatConstants()).doesNotThrowAnyException();
    }
}
