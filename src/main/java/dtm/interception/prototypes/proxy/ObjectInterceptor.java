package dtm.interception.prototypes.proxy;

import dtm.interception.annotations.aop.DisableInterception;
import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.InterceptorChain;
import dtm.interception.utils.ReflectionUtils;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;
import net.bytebuddy.implementation.bind.annotation.This;

import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Destino da delegação dos proxies gerados: empacota cada chamada em um {@link MethodCallContext}
 * e a entrega ao {@link InterceptorChain}.
 */
public class ObjectInterceptor {
    private final Object delegate;
    private final Class<?> serviceType;
    private final InterceptorChain interceptorChain;
    private final boolean serviceDisabled;

    ObjectInterceptor(Object delegate, Class<?> serviceType, InterceptorChain interceptorChain){
        this.delegate = delegate;
        this.serviceType = serviceType;
        this.interceptorChain = interceptorChain;
        this.serviceDisabled = serviceType.isAnnotationPresent(DisableInterception.class);
    }

    @RuntimeType
    public Object intercept(
            @Origin Method method,
            @AllArguments Object[] args,
            @This Object proxy
    ) throws Throwable  {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(method, args, proxy);
        }

        if (serviceDisabled
                || method.isAnnotationPresent(DisableInterception.class)
                || interceptorChain.getInterceptors(method).isEmpty()) {
            return invokeDelegate(method, args);
        }

        final MethodCallContext context = new MethodCallContext(delegate, serviceType, method, args, proxy);

        if (isSuspending(method)) {
            return interceptorChain.executeAsync(context, () -> toStage(invokeDelegate(method, context.getArgumentArray())));
        }

        return interceptorChain.execute(context, () -> invokeDelegate(method, context.getArgumentArray()));
    }

    Object getDelegate() {
        return delegate;
    }

    private Object invokeDelegate(Method method, Object[] args) throws Throwable {
        if (!method.canAccess(delegate)) {
            method.setAccessible(true);
        }
        return ReflectionUtils.invokeUnwrapped(method, delegate, args);
    }

    private Object invokeObjectMethod(Method method, Object[] args, Object proxy) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return args.length == 1 && args[0] == proxy;
            case "hashCode":
                return System.identityHashCode(proxy);
            default:
                return ReflectionUtils.invokeUnwrapped(method, delegate, args);
        }
    }

    @SuppressWarnings("unchecked")
    private static CompletionStage<Object> toStage(Object value) {
        return (CompletionStage<Object>) value;
    }

    static boolean isSuspending(Method method) {
        Class<?> returnType = method.getReturnType();
        return returnType == CompletionStage.class || returnType == CompletableFuture.class;
    }

}
