package com.ai.webscraper.concurrent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrierTest {

    private RecordingSleeper sleeper;
    private Retrier retrier;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        retrier = new Retrier(sleeper);
    }

    @Test
    void exponentialDelaysAreOneTwoFourSeconds() {
        ExponentialRetryPolicy policy = new ExponentialRetryPolicy(4, Duration.ofMillis(1000), 2.0);

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void withRetriesAddsTheFirstAttempt() {
        assertThat(ExponentialRetryPolicy.withRetries(2, Duration.ofSeconds(1), 2.0, e -> true).maxAttempts())
                .isEqualTo(3);
        assertThat(ExponentialRetryPolicy.withRetries(-1, Duration.ofSeconds(1), 2.0, e -> true).maxAttempts())
                .isEqualTo(1);
    }

    @Test
    void rejectsInvalidPolicyArguments() {
        assertThatThrownBy(() -> new ExponentialRetryPolicy(0, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialRetryPolicy(1, Duration.ZERO, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void succeedsAfterTransientFailuresAndSleepsBetweenAttempts() throws Exception {
        List<Integer> attempts = new ArrayList<>();

        String result = retrier.execute(new ExponentialRetryPolicy(3, Duration.ofMillis(1000), 2.0), "fetch",
                attempt -> {
                    attempts.add(attempt);
                    if (attempt < 2) {
                        throw new IOException("flaky");
                    }
                    return "ok";
                });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).containsExactly(0, 1, 2);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
    }

    @Test
    void lastFailureIsRethrownWithoutTrailingSleep() {
        assertThatThrownBy(() -> retrier.execute(new ExponentialRetryPolicy(2, Duration.ofMillis(10), 2.0), "fetch",
                attempt -> {
                    throw new IOException("down " + attempt);
                }))
                .isInstanceOf(IOException.class)
                .hasMessage("down 1");

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(10));
    }

    @Test
    void nonRetryableFailureStopsImmediately() {
        ExponentialRetryPolicy policy = new ExponentialRetryPolicy(5, Duration.ofMillis(10), 2.0,
                e -> !(e instanceof IllegalArgumentException));
        List<Integer> attempts = new ArrayList<>();

        assertThatThrownBy(() -> retrier.execute(policy, "fetch", attempt -> {
            attempts.add(attempt);
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(attempts).containsExactly(0);
        assertThat(sleeper.sleeps()).isEmpty();
    }
}
