package dtm.interception.core;

import dtm.interception.configurations.InterceptionConfigurations;
import dtm.interception.prototypes.MethodFilter;
import dtm.interception.prototypes.MethodInterceptor;
import dtm.interception.prototypes.proxy.ProxyFactory;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * API fluente para montar um proxy interceptado.
 *
 * <pre>{@code
 * TodoRepository proxy = InterceptionBuilder.of(TodoRepository.class, repository)
 *         .addInterceptor(new LoggingInterceptor())
 *         .addInterceptor(auditInterceptor, MethodFilter.named("remove"))
 *         .withConfigurations(InterceptionConfigurationsStorage.fromSystemProperties())
 *         .build();
 * }</pre>
 *
 * @param <T> interface de serviço
 */
public class InterceptionBuilder<T> {

    private final Class<T> serviceType;
    private final T instance;
    private final List<InterceptorRegistration> registrations = new ArrayList<>();
    private InterceptionConfigurations configurations = new InterceptionConfigurations() {};

    private InterceptionBuilder(Class<T> serviceType, T instance) {
        this.serviceType = serviceType;
        this.instance = instance;
    }

    public static <T> InterceptionBuilder<T> of(@NonNull Class<T> serviceType, @NonNull T instance) {
        return new InterceptionBuilder<>(serviceType, instance);
    }

    public InterceptionBuilder<T> addInterceptor(@NonNull MethodInterceptor interceptor) {
        registrations.add(InterceptorRegistration.of(interceptor));
        return this;
    }

    public InterceptionBuilder<T> addInterceptor(@NonNull MethodInterceptor interceptor, @NonNull MethodFilter filter) {
        registrations.add(InterceptorRegistration.of(interceptor).withMethodFilter(filter));
        return this;
    }

    public InterceptionBuilder<T> addRegistration(@NonNull InterceptorRegistration registration) {
        registrations.add(registration);
        return this;
    }

    public InterceptorGroup<T> createInterceptorGroup() {
        InterceptorRegistration registration = new InterceptorRegistration();
        registrations.add(registration);
        return new InterceptorGroup<>(this, registration);
    }

    public InterceptionBuilder<T> withConfigurations(@NonNull InterceptionConfigurations configurations) {
        this.configurations = configurations;
        return this;
    }

    public DefaultInterceptorChain buildChain() {
        return new DefaultInterceptorChain(registrations, configurations);
    }

    public T build() {
        return ProxyFactory.newProxyObject(serviceType, instance, buildChain());
    }

}
