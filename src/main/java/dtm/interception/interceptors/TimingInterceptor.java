package dtm.interception.interceptors;

import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.MethodInterceptor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Mede a duração de cada chamada e acumula {@link MethodTimings} por método, no formato
 * {@code Servico.metodo}. Chamadas assíncronas são medidas até a conclusão do resultado.
 */
@Slf4j
public class TimingInterceptor implements MethodInterceptor {

    public static final String START_KEY = "TimingInterceptor_Start";

    private final LongSupplier nanoTime;
    private final Map<String, MethodTimings> timings = new ConcurrentHashMap<>();

    public TimingInterceptor() {
        this(System::nanoTime);
    }

    public TimingInterceptor(@NonNull LongSupplier nanoTime) {
        this.nanoTime = nanoTime;
    }

    @Override
    public void beforeInvoke(MethodCallContext context) {
        context.putItem(START_KEY, nanoTime.getAsLong());
    }

    @Override
    public void afterInvoke(MethodCallContext context) {
        record(context, false);
    }

    @Override
    public void onException(MethodCallContext context) {
        record(context, true);
    }

    public Map<String, MethodTimings> getTimings() {
        return Collections.unmodifiableMap(timings);
    }

    public Optional<MethodTimings> getTimings(@NonNull String key) {
        return Optional.ofNullable(timings.get(key));
    }

    private void record(MethodCallContext context, boolean failed) {
        Optional<Long> start = context.getItem(START_KEY, Long.class);
        if (start.isEmpty()) return;

        long elapsed = nanoTime.getAsLong() - start.get();
        String key = keyOf(context);
        timings.computeIfAbsent(key, k -> new MethodTimings()).record(elapsed, failed);
        log.trace("{} levou {} ns", key, elapsed);
    }

    static String keyOf(MethodCallContext context) {
        return context.getServiceType().getSimpleName() + "." + context.getMethodName();
    }

}
