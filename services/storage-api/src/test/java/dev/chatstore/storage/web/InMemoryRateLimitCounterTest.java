package dev.chatstore.storage.web;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimitCounterTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private final InMemoryRateLimitCounter counter = new InMemoryRateLimitCounter();

    @Test
    void countsWithinWindow_andResetsOnNewWindow() {
        assertThat(counter.increment("k", 0, WINDOW)).isEqualTo(1);
        assertThat(counter.increment("k", 0, WINDOW)).isEqualTo(2);
        assertThat(counter.increment("other", 0, WINDOW)).isEqualTo(1);

        assertThat(counter.increment("k", 60_000, WINDOW)).isEqualTo(1);
    }

    @Test
    void entriesFromEarlierWindows_areEvicted() {
        for (int i = 0; i < 500; i++) {
            counter.increment("resume-message:10.0.0." + i, 0, WINDOW);
        }
        assertThat(counter.size()).isEqualTo(500);

        assertThat(counter.increment("resume-message:10.0.0.1", 60_000, WINDOW)).isEqualTo(1);

        assertThat(counter.size()).isEqualTo(1);
    }

    @Test
    void lateCallForOlderWindow_doesNotEvictCurrentOnes() {
        counter.increment("a", 60_000, WINDOW);
        counter.increment("b", 0, WINDOW);

        assertThat(counter.increment("a", 60_000, WINDOW)).isEqualTo(2);
    }

    @Test
    void concurrentIncrements_areNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 1000; i++) {
                pool.submit(() -> counter.increment("busy", 0, WINDOW));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(counter.increment("busy", 0, WINDOW)).isEqualTo(1001);
    }
}
