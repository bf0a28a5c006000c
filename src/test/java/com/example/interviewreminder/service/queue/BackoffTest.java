package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.config.ReminderQueueProperties;
import com.example.interviewreminder.domain.enums.BackoffType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Backoff and JobOptions Tests")
class BackoffTest {

    @Nested
    @DisplayName("Backoff")
    class BackoffTests {

        @Test
        @DisplayName("Exponential backoff should double after each failure")
        void exponentialShouldDouble() {
            var backoff = Backoff.exponential(Duration.ofSeconds(60));

            assertThat(backoff.delayAfter(1)).isEqualTo(Duration.ofSeconds(60));
            assertThat(backoff.delayAfter(2)).isEqualTo(Duration.ofSeconds(120));
            assertThat(backoff.delayAfter(3)).isEqualTo(Duration.ofSeconds(240));
        }

        @Test
        @DisplayName("Fixed backoff should not grow")
        void fixedShouldNotGrow() {
            var backoff = Backoff.fixed(Duration.ofSeconds(30));

            assertThat(backoff.delayAfter(1)).isEqualTo(Duration.ofSeconds(30));
            assertThat(backoff.delayAfter(5)).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("Should reject a delay before any failure")
        void shouldRejectZeroAttempts() {
            var backoff = Backoff.exponential(Duration.ofSeconds(60));

            assertThatThrownBy(() -> backoff.delayAfter(0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject a negative delay")
        void shouldRejectNegativeDelay() {
            assertThatThrownBy(() -> Backoff.of(BackoffType.FIXED, -1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("JobOptions")
    class JobOptionsTests {

        @Test
        @DisplayName("Defaults should be three attempts with one minute exponential backoff")
        void defaultsFromProperties() {
            var options = JobOptions.from(new ReminderQueueProperties());

            assertThat(options.getAttempts()).isEqualTo(3);
            assertThat(options.getBackoff().getType()).isEqualTo(BackoffType.EXPONENTIAL);
            assertThat(options.getBackoff().getDelayMs()).isEqualTo(60000L);
        }

        @Test
        @DisplayName("Should reject fewer than one attempt")
        void shouldRejectZeroAttempts() {
            assertThatThrownBy(() -> JobOptions.of(0, Backoff.fixed(Duration.ofSeconds(1))))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
