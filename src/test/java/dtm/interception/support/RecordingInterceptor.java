package dtm.interception.support;

import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.MethodInterceptor;

import java.util.List;

/**
 * Interceptador de teste que anota cada hook em um diário compartilhado.
 * Quando {@code marker} não é null, acrescenta o marcador a resultados {@code String}.
 */
public class RecordingInterceptor implements MethodInterceptor {

    private final String name;
    private final List<String> journal;
    private final int order;
    private final String marker;

    public RecordingInterceptor(String name, List<String> journal) {
        this(name, journal, 0, null);
    }

    public RecordingInterceptor(String name, List<String> journal, int order) {
        this(name, journal, order, null);
    }

    public RecordingInterceptor(String name, List<String> journal, int order, String marker) {
        this.name = name;
        this.journal = journal;
        this.order = order;
        this.marker = marker;
    }

    @Override
    public void beforeInvoke(MethodCallContext context) {
        journal.add(name + ".Before");
    }

    @Override
    public void afterInvoke(MethodCallContext context) {
        journal.add(name + ".After");
    }

    @Override
    public void onException(MethodCallContext context) {
        journal.add(name + ".Exception");
    }

    @Override
    public Object transformResult(MethodCallContext context, Object previousOutput) {
        if (marker != null && previousOutput instanceof String text) {
            return text + marker;
        }
        return previousOutput;
    }

    @Override
    public int getOrder() {
        return order;
    }

}
