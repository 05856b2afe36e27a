package com.firefly.stageengine.concurrency;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void intervalIsDerivedFromRate() {
        RateLimiter limiter = new RateLimiter(20);
        assertEquals(Duration.ofMillis(50), limiter.interval());
        assertEquals(20.0, limiter.requestsPerSecond());
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(-3));
    }

    @Test
    void spacesStartsEvenWhenRequestedConcurrently() {
        RateLimiter limiter = new RateLimiter(20);

        List<Long> starts = Flux.range(0, 4)
                .flatMap(i -> limiter.limit(() -> Mono.fromCallable(System::nanoTime)))
                .collectSortedList()
                .block(Duration.ofSeconds(5));

        assertNotNull(starts);
        assertEquals(4, starts.size());
        long spreadMillis = Duration.ofNanos(starts.get(3) - starts.get(0)).toMillis();
        assertTrue(spreadMillis >= 140, "starts spread over " + spreadMillis + "ms");
    }
}
