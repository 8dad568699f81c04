package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.exception.RecognitionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultChannelTest {

    @Test
    void shouldYieldItemsInPublishOrderThenEnd() {
        // Arrange
        ResultChannel<String> channel = new ResultChannel<>();
        channel.publish("a");
        channel.publish("b");
        channel.close();

        // Act
        List<String> seen = new ArrayList<>();
        channel.forEach(seen::add);

        // Assert
        assertThat(seen).containsExactly("a", "b");
    }

    @Test
    void shouldSurfaceFailureAfterDrainingBufferedItems() {
        // Arrange
        ResultChannel<String> channel = new ResultChannel<>();
        channel.publish("a");
        channel.fail(new RecognitionException("transport closed"));
        Iterator<String> it = channel.iterator();

        // Act + Assert
        assertThat(it.next()).isEqualTo("a");
        assertThatThrownBy(it::hasNext)
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("transport closed");
    }

    @Test
    void shouldDropItemsPublishedAfterClose() {
        // Arrange
        ResultChannel<String> channel = new ResultChannel<>();
        channel.close();

        // Act
        boolean accepted = channel.publish("late");

        // Assert
        assertThat(accepted).isFalse();
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    void shouldReturnNullFromPollWhenNothingArrives() throws InterruptedException {
        ResultChannel<String> channel = new ResultChannel<>();

        assertThat(channel.poll(Duration.ofMillis(20))).isNull();
        assertThat(channel.tryPoll()).isNull();
    }

    @Test
    void shouldKeepEndVisibleToRepeatedPolls() {
        // Arrange
        ResultChannel<String> channel = new ResultChannel<>();
        channel.close();

        // Act + Assert
        assertThatThrownBy(channel::tryPoll).isInstanceOf(RecognitionException.class);
        assertThatThrownBy(channel::tryPoll).isInstanceOf(RecognitionException.class);
    }

    @Test
    void shouldNotBeRestartable() {
        ResultChannel<String> channel = new ResultChannel<>();
        channel.iterator();

        assertThatThrownBy(channel::iterator).isInstanceOf(IllegalStateException.class);
    }
}
