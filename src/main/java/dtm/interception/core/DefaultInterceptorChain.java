package dtm.interception.core;

import dtm.interception.configurations.InterceptionConfigurations;
import dtm.interception.exceptions.InterceptorHookException;
import dtm.interception.prototypes.InterceptorChain;
import dtm.interception.prototypes.Invocable;
import dtm.interception.prototypes.MethodInterceptor;
import dtm.interception.prototypes.async.AsyncInvocable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executor padrão da cadeia de interceptadores.
 *
 * <h3>Algoritmo</h3>
 * <ol>
 *     <li>Resolve os interceptadores aplicáveis: união dos registros cujo filtro aceita o método,
 *     ordenada de forma estável por {@link MethodInterceptor#getOrder()}.</li>
 *     <li>{@code beforeInvoke} em ordem crescente. Uma falha aqui impede a chamada real e segue o
 *     caminho de falha.</li>
 *     <li>Chamada real. Operações suspensas recebem uma continuação, nunca um {@code join}.</li>
 *     <li>Sucesso: pipeline de {@code transformResult} em ordem crescente, depois {@code afterInvoke}
 *     em ordem decrescente.</li>
 *     <li>Falha ou cancelamento: {@code onException} em ordem crescente em todos os interceptadores,
 *     e a exceção original é relançada.</li>
 * </ol>
 *
 * <p>Falhas dos próprios hooks nas fases After, Transform e Exception são coletadas no contexto,
 * registradas em log e nunca substituem o resultado da chamada real.</p>
 *
 * <p>Os registros são copiados na construção: alterações posteriores não afetam a cadeia.</p>
 */
@Slf4j
public class DefaultInterceptorChain implements InterceptorChain {

    private final List<InterceptorRegistration> registrations;
    private final InterceptionConfigurations configurations;
    private final Map<Method, List<MethodInterceptor>> resolvedInterceptors = new ConcurrentHashMap<>();

    public DefaultInterceptorChain(@NonNull List<InterceptorRegistration> registrations) {
        this(registrations, new InterceptionConfigurations() {});
    }

    public DefaultInterceptorChain(
            @NonNull List<InterceptorRegistration> registrations,
            @NonNull InterceptionConfigurations configurations
    ) {
        List<InterceptorRegistration> copies = new ArrayList<>(registrations.size());
        for (InterceptorRegistration registration : registrations) {
            copies.add(registration.snapshot());
        }
        this.registrations = Collections.unmodifiableList(copies);
        this.configurations = configurations;
    }

    public static DefaultInterceptorChain of(@NonNull MethodInterceptor... interceptors) {
        return new DefaultInterceptorChain(List.of(InterceptorRegistration.of(interceptors)));
    }

    public InterceptionConfigurations getConfigurations() {
        return configurations;
    }

    @Override
    public List<MethodInterceptor> getInterceptors(@NonNull Method method) {
        if (configurations.isCacheResolvedInterceptors()) {
            return resolvedInterceptors.computeIfAbsent(method, this::resolveInterceptors);
        }
        return resolveInterceptors(method);
    }

    @Override
    public Object execute(@NonNull MethodCallContext context, @NonNull Invocable invocable) throws Throwable {
        List<MethodInterceptor> interceptors = getInterceptors(context.getMethod());
        if (interceptors.isEmpty()) {
            return invocable.proceed();
        }

        Object value;
        try {
            runBefore(context, interceptors);
            value = invocable.proceed();
        } catch (Throwable error) {
            throw handleFailure(context, interceptors, error);
        }

        return handleSuccess(context, interceptors, value);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(
            @NonNull MethodCallContext context,
            @NonNull AsyncInvocable<T> invocable
    ) throws Throwable {
        List<MethodInterceptor> interceptors = getInterceptors(context.getMethod());
        if (interceptors.isEmpty()) {
            CompletionStage<T> stage = invocable.proceed();
            return (stage != null) ? stage.toCompletableFuture() : null;
        }

        final CompletionStage<T> stage;
        try {
            runBefore(context, interceptors);
            stage = invocable.proceed();
            if (stage == null) {
                throw new NullPointerException(
                        "Operação " + context.getMethodName() + " retornou null no lugar de um CompletionStage"
                );
            }
        } catch (Throwable error) {
            throw handleFailure(context, interceptors, error);
        }

        final CompletableFuture<T> result = new CompletableFuture<>();
        final AtomicBoolean settled = new AtomicBoolean(false);

        result.whenComplete((ignored, error) -> {
            if (!result.isCancelled()) return;
            if (settled.compareAndSet(false, true)) {
                handleFailure(context, interceptors, cancellationOf(context, error));
            }
            forwardCancellation(context, stage);
        });

        stage.whenComplete((value, error) -> {
            if (!settled.compareAndSet(false, true)) return;
            try {
                settle(context, interceptors, result, value, error);
            } catch (Throwable unexpected) {
                log.error("Erro inesperado ao concluir a chamada {}", context, unexpected);
                result.completeExceptionally(unexpected);
            }
        });

        return result;
    }

    /**
     * Repassa o cancelamento ao estágio da operação real. Estágios que não aceitam {@code cancel}
     * (por exemplo {@link CompletableFuture#minimalCompletionStage()}) apenas geram um aviso.
     */
    private static void forwardCancellation(MethodCallContext context, CompletionStage<?> stage) {
        if (!(stage instanceof Future<?> cancellable)) return;
        try {
            cancellable.cancel(true);
        } catch (RuntimeException e) {
            log.warn("Não foi possível repassar o cancelamento de {} ao estágio da operação", context.getMethodName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void settle(
            MethodCallContext context,
            List<MethodInterceptor> interceptors,
            CompletableFuture<T> result,
            T value,
            Throwable error
    ) {
        if (error == null && result.isCancelled()) {
            error = new CancellationException("Chamada " + context.getMethodName() + " cancelada pelo chamador");
        }

        if (error != null) {
            Throwable cause = handleFailure(context, interceptors, unwrapCompletion(error));
            result.completeExceptionally(cause);
            return;
        }

        Object output = handleSuccess(context, interceptors, value);
        result.complete((T) output);
    }

    private void runBefore(MethodCallContext context, List<MethodInterceptor> interceptors) throws Exception {
        for (MethodInterceptor interceptor : interceptors) {
            interceptor.beforeInvoke(context);
        }
    }

    private Object handleSuccess(MethodCallContext context, List<MethodInterceptor> interceptors, Object value) {
        context.succeed(value);

        Object output = value;
        for (MethodInterceptor interceptor : interceptors) {
            try {
                output = interceptor.transformResult(context, output);
            } catch (Exception e) {
                recordHookFailure(context, interceptor, "transformResult", e);
            }
        }
        context.replaceResult(output);

        for (int i = interceptors.size() - 1; i >= 0; i--) {
            MethodInterceptor interceptor = interceptors.get(i);
            try {
                interceptor.afterInvoke(context);
            } catch (Exception e) {
                recordHookFailure(context, interceptor, "afterInvoke", e);
            }
        }

        reportHookFailures(context);
        return output;
    }

    /**
     * Notifica todos os interceptadores e devolve a exceção original, que deve ser relançada.
     */
    private Throwable handleFailure(MethodCallContext context, List<MethodInterceptor> interceptors, Throwable error) {
        boolean cancelled = error instanceof CancellationException;
        context.fail(error, cancelled);

        for (MethodInterceptor interceptor : interceptors) {
            try {
                interceptor.onException(context);
            } catch (Exception e) {
                recordHookFailure(context, interceptor, "onException", e);
            }
        }

        if (configurations.isAttachHookErrorsAsSuppressed()) {
            for (Throwable hookError : context.getHookErrors()) {
                if (hookError != error) error.addSuppressed(hookError);
            }
        }

        reportHookFailures(context);
        return error;
    }

    private void recordHookFailure(MethodCallContext context, MethodInterceptor interceptor, String hook, Exception error) {
        log.debug("Falha no hook {} do interceptador {} em {}",
                hook, interceptor.getClass().getName(), context.getMethodName(), error);
        context.addHookError(error);
    }

    private void reportHookFailures(MethodCallContext context) {
        List<Throwable> errors = context.getHookErrors();
        if (errors.isEmpty() || !configurations.isLogHookErrors()) return;

        InterceptorHookException aggregated = new InterceptorHookException(
                "Falhas nos hooks dos interceptadores durante " +
                        context.getTargetType().getSimpleName() + "." + context.getMethodName()
        );
        for (Throwable error : errors) {
            aggregated.addError(error);
            aggregated.addSuppressed(error);
        }
        log.error(aggregated.getMessage(), aggregated);
    }

    private List<MethodInterceptor> resolveInterceptors(Method method) {
        List<MethodInterceptor> applicable = new ArrayList<>();
        Set<MethodInterceptor> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (InterceptorRegistration registration : registrations) {
            if (!shouldApplyRegistration(registration, method)) continue;

            for (MethodInterceptor interceptor : registration.getInterceptors()) {
                if (configurations.isDeduplicateInterceptors() && !seen.add(interceptor)) continue;
                applicable.add(interceptor);
            }
        }

        // List.sort é estável: mesma prioridade mantém a ordem de registro
        applicable.sort(Comparator.comparingInt(MethodInterceptor::getOrder));
        return List.copyOf(applicable);
    }

    private boolean shouldApplyRegistration(InterceptorRegistration registration, Method method) {
        try {
            return registration.matches(method);
        } catch (Exception e) {
            log.warn("Filtro de métodos falhou para {}. Registro ignorado.", method.getName(), e);
            return false;
        }
    }

    private static Throwable unwrapCompletion(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CancellationException cancellationOf(MethodCallContext context, Throwable error) {
        Throwable cause = unwrapCompletion(error);
        if (cause instanceof CancellationException cancellation) {
            return cancellation;
        }
        return new CancellationException("Chamada " + context.getMethodName() + " cancelada pelo chamador");
    }

}
