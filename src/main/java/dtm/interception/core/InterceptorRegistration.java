package dtm.interception.core;

import dtm.interception.prototypes.MethodFilter;
import dtm.interception.prototypes.MethodInterceptor;
import lombok.NonNull;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Associa um conjunto ordenado de interceptadores a um filtro de métodos opcional.
 * Sem filtro, o registro vale para todos os métodos.
 */
public class InterceptorRegistration {

    private final List<MethodInterceptor> interceptors = new ArrayList<>();
    private MethodFilter methodFilter = MethodFilter.all();

    public static InterceptorRegistration of(@NonNull MethodInterceptor... interceptors) {
        InterceptorRegistration registration = new InterceptorRegistration();
        for (MethodInterceptor interceptor : interceptors) {
            registration.addInterceptor(interceptor);
        }
        return registration;
    }

    public InterceptorRegistration addInterceptor(@NonNull MethodInterceptor interceptor) {
        interceptors.add(interceptor);
        return this;
    }

    public InterceptorRegistration withMethodFilter(@NonNull MethodFilter filter) {
        this.methodFilter = filter;
        return this;
    }

    public boolean matches(Method method) {
        return methodFilter.matches(method);
    }

    public List<MethodInterceptor> getInterceptors() {
        return Collections.unmodifiableList(interceptors);
    }

    public MethodFilter getMethodFilter() {
        return methodFilter;
    }

    /**
     * Cópia desacoplada, para que alterações após a construção do proxy não afetem a cadeia.
     */
    InterceptorRegistration snapshot() {
        InterceptorRegistration copy = new InterceptorRegistration();
        copy.interceptors.addAll(interceptors);
        copy.methodFilter = methodFilter;
        return copy;
    }

}
