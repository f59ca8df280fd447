package dtm.interception.core;

import lombok.Getter;
import lombok.NonNull;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro de uma única chamada interceptada, compartilhado por todos os interceptadores da cadeia.
 *
 * <p>O número de argumentos é fixo na criação. {@code result} e {@code exception} são mutuamente
 * exclusivos após a transição terminal, feita somente pelo executor da cadeia.
 * Os {@link #getItems() itens} existem apenas durante a chamada e são descartados depois.</p>
 */
@Getter
public class MethodCallContext {

    /**
     * Instância concreta que recebe a chamada real. Pertence ao chamador, não ao proxy.
     */
    private final Object targetInstance;
    private final Class<?> targetType;
    private final Class<?> serviceType;
    private final Method method;
    private final Object proxy;
    private final Map<String, Object> items;

    @Getter(lombok.AccessLevel.NONE)
    private final Object[] arguments;

    @Getter(lombok.AccessLevel.NONE)
    private final List<Throwable> hookErrors = Collections.synchronizedList(new ArrayList<>());

    private volatile Object result;
    private volatile Throwable exception;
    private volatile CallState state;

    public MethodCallContext(@NonNull Object targetInstance, @NonNull Method method, Object[] arguments) {
        this(targetInstance, method.getDeclaringClass(), method, arguments, null);
    }

    public MethodCallContext(
            @NonNull Object targetInstance,
            @NonNull Class<?> serviceType,
            @NonNull Method method,
            Object[] arguments,
            Object proxy
    ) {
        this.targetInstance = targetInstance;
        this.targetType = targetInstance.getClass();
        this.serviceType = serviceType;
        this.method = method;
        this.arguments = (arguments != null) ? arguments : new Object[0];
        this.proxy = proxy;
        this.items = new HashMap<>();
        this.state = CallState.PENDING;
    }

    public String getMethodName() {
        return method.getName();
    }

    public int getArgumentCount() {
        return arguments.length;
    }

    /**
     * Visão de tamanho fixo dos argumentos. {@code set} é permitido, {@code add}/{@code remove} não.
     */
    public List<Object> getArguments() {
        return Arrays.asList(arguments);
    }

    /**
     * Array vivo de argumentos, o mesmo entregue à chamada real.
     */
    public Object[] getArgumentArray() {
        return arguments;
    }

    @SuppressWarnings("unchecked")
    public <T> T getArgument(int index) {
        checkIndex(index);
        return (T) arguments[index];
    }

    public <T> T getArgument(int index, @NonNull Class<T> type) {
        checkIndex(index);
        return type.cast(arguments[index]);
    }

    public void setArgument(int index, Object value) {
        checkIndex(index);
        arguments[index] = value;
    }

    public <T> Optional<T> getItem(@NonNull String key, @NonNull Class<T> type) {
        Object value = items.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void putItem(@NonNull String key, Object value) {
        items.put(key, value);
    }

    public boolean isCancelled() {
        return state == CallState.CANCELLED;
    }

    public boolean isSucceeded() {
        return state == CallState.SUCCEEDED;
    }

    /**
     * Falhas lançadas pelos hooks dos interceptadores nesta chamada, na ordem em que ocorreram.
     */
    public List<Throwable> getHookErrors() {
        synchronized (hookErrors) {
            return List.copyOf(hookErrors);
        }
    }

    void addHookError(Throwable error) {
        hookErrors.add(error);
    }

    void succeed(Object value) {
        ensurePending();
        this.result = value;
        this.exception = null;
        this.state = CallState.SUCCEEDED;
    }

    void replaceResult(Object value) {
        if (state != CallState.SUCCEEDED) {
            throw new IllegalStateException("Resultado só pode ser substituído após sucesso: " + state);
        }
        this.result = value;
    }

    void fail(@NonNull Throwable error, boolean cancelled) {
        ensurePending();
        this.result = null;
        this.exception = error;
        this.state = cancelled ? CallState.CANCELLED : CallState.FAILED;
    }

    private void ensurePending() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Chamada " + getMethodName() + " já finalizada: " + state);
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= arguments.length) {
            throw new IndexOutOfBoundsException(
                    "Argumento " + index + " fora do intervalo para " + getMethodName() + " (total: " + arguments.length + ")"
            );
        }
    }

    @Override
    public String toString() {
        return "MethodCallContext{" +
                "method=" + targetType.getSimpleName() + "." + getMethodName() +
                ", arguments=" + arguments.length +
                ", state=" + state +
                '}';
    }

}
