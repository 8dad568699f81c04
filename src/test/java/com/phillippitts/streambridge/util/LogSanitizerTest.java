package com.phillippitts.streambridge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldKeepShortPreviewUnchanged() {
        assertThat(LogSanitizer.preview("turn left at the lights")).isEqualTo("turn left at the lights");
    }

    @Test
    void shouldMarkTruncatedPreview() {
        String preview = LogSanitizer.preview("a".repeat(100));

        assertThat(preview).isEqualTo("a".repeat(40) + "...");
    }

    @Test
    void shouldReplaceControlCharactersInPreview() {
        // a client-supplied newline must not start a new log line
        assertThat(LogSanitizer.preview("bad\ntype\r\u0007")).isEqualTo("bad_type__");
    }
}
