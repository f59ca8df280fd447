package dtm.interception.interceptors;

import java.time.Duration;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Estatísticas acumuladas de um método. Seguro para atualização concorrente.
 */
public class MethodTimings {

    private final LongAdder count = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();
    private final LongAccumulator maxNanos = new LongAccumulator(Math::max, 0L);

    void record(long elapsedNanos, boolean failed) {
        long elapsed = Math.max(0L, elapsedNanos);
        count.increment();
        totalNanos.add(elapsed);
        maxNanos.accumulate(elapsed);
        if (failed) failures.increment();
    }

    public long getCount() {
        return count.sum();
    }

    public long getFailures() {
        return failures.sum();
    }

    public Duration getTotal() {
        return Duration.ofNanos(totalNanos.sum());
    }

    public Duration getMax() {
        return Duration.ofNanos(maxNanos.get());
    }

    public Duration getAverage() {
        long calls = count.sum();
        return (calls == 0) ? Duration.ZERO : Duration.ofNanos(totalNanos.sum() / calls);
    }

    @Override
    public String toString() {
        return "MethodTimings{" +
                "count=" + getCount() +
                ", failures=" + getFailures() +
                ", total=" + getTotal() +
                ", max=" + getMax() +
                '}';
    }

}
