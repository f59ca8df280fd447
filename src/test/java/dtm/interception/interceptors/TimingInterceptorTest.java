package dtm.interception.interceptors;

import dtm.interception.core.InterceptionBuilder;
import dtm.interception.support.Greeter;
import dtm.interception.support.SimpleGreeter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TimingInterceptorTest {

    @Test
    void accumulatesPerMethodStatistics() throws Exception {
        AtomicLong ticker = new AtomicLong();
        TimingInterceptor timing = new TimingInterceptor(() -> ticker.getAndAdd(100));
        Greeter proxy = InterceptionBuilder.of(Greeter.class, new SimpleGreeter())
                .addInterceptor(timing)
                .build();

        proxy.greet("Ana");
        proxy.greet("Bia");
        assertThrows(IOException.class, proxy::failChecked);

        MethodTimings greet = timing.getTimings("Greeter.greet").orElseThrow();
        assertEquals(2, greet.getCount());
        assertEquals(0, greet.getFailures());
        assertEquals(Duration.ofNanos(200), greet.getTotal());
        assertEquals(Duration.ofNanos(100), greet.getMax());
        assertEquals(Duration.ofNanos(100), greet.getAverage());

        MethodTimings failed = timing.getTimings("Greeter.failChecked").orElseThrow();
        assertEquals(1, failed.getCount());
        assertEquals(1, failed.getFailures());
    }

    @Test
    void asyncCallsAreMeasuredUntilCompletion() {
        AtomicLong ticker = new AtomicLong();
        TimingInterceptor timing = new TimingInterceptor(ticker::get);
        SimpleGreeter target = new SimpleGreeter();
        CompletableFuture<String> pending = new CompletableFuture<>();
        target.setPendingGreeting(pending);
        Greeter proxy = InterceptionBuilder.of(Greeter.class, target)
                .addInterceptor(timing)
                .build();

        CompletableFuture<String> result = proxy.greetAsync("Ana");
        assertTrue(timing.getTimings().isEmpty());

        ticker.set(5_000);
        pending.complete("ok");

        assertEquals("ok", result.join());
        assertEquals(Duration.ofNanos(5_000), timing.getTimings("Greeter.greetAsync").orElseThrow().getTotal());
    }

    @Test
    void emptyTimingsHaveZeroAverage() {
        assertEquals(Duration.ZERO, new MethodTimings().getAverage());
    }

}
