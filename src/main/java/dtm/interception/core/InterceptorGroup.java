package dtm.interception.core;

import dtm.interception.prototypes.MethodFilter;
import dtm.interception.prototypes.MethodInterceptor;

/**
 * Grupo de interceptadores que compartilham um mesmo filtro de métodos dentro de um
 * {@link InterceptionBuilder}.
 *
 * <pre>{@code
 * TodoRepository proxy = InterceptionBuilder.of(TodoRepository.class, repository)
 *         .createInterceptorGroup()
 *             .withMethodFilter(MethodFilter.named("remove"))
 *             .addInterceptor(auditInterceptor)
 *         .endGroup()
 *         .build();
 * }</pre>
 */
public class InterceptorGroup<T> {

    private final InterceptionBuilder<T> builder;
    private final InterceptorRegistration registration;

    InterceptorGroup(InterceptionBuilder<T> builder, InterceptorRegistration registration) {
        this.builder = builder;
        this.registration = registration;
    }

    public InterceptorGroup<T> addInterceptor(MethodInterceptor interceptor) {
        registration.addInterceptor(interceptor);
        return this;
    }

    public InterceptorGroup<T> withMethodFilter(MethodFilter filter) {
        registration.withMethodFilter(filter);
        return this;
    }

    public InterceptionBuilder<T> endGroup() {
        return builder;
    }

}
