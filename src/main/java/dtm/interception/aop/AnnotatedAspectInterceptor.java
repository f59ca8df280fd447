package dtm.interception.aop;

import dtm.interception.annotations.aop.AfterException;
import dtm.interception.annotations.aop.AfterExecution;
import dtm.interception.annotations.aop.Aspect;
import dtm.interception.annotations.aop.BeforeExecution;
import dtm.interception.annotations.aop.InterceptorOrder;
import dtm.interception.annotations.aop.Pointcut;
import dtm.interception.annotations.aop.ProxyInstance;
import dtm.interception.annotations.aop.ResultProxy;
import dtm.interception.core.InterceptorRegistration;
import dtm.interception.core.MethodCallContext;
import dtm.interception.exceptions.InterceptionException;
import dtm.interception.exceptions.InvalidAspectException;
import dtm.interception.prototypes.MethodFilter;
import dtm.interception.prototypes.MethodInterceptor;
import dtm.interception.utils.ReflectionUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapta uma classe anotada com {@link Aspect} para o contrato {@link MethodInterceptor}.
 *
 * <ul>
 *     <li>{@link Pointcut} → filtro de métodos (avaliado uma vez por método).</li>
 *     <li>{@link BeforeExecution} → {@link #beforeInvoke}.</li>
 *     <li>{@link AfterExecution} com retorno → {@link #transformResult}; {@code void} → {@link #afterInvoke}.</li>
 *     <li>{@link AfterException} → {@link #onException}.</li>
 * </ul>
 *
 * <pre>{@code
 * MethodInterceptor interceptor = AnnotatedAspectInterceptor.of(new RemoveAuditAspect());
 * }</pre>
 */
@Slf4j
public class AnnotatedAspectInterceptor implements MethodInterceptor {

    private final Object aspect;
    private final Method pointcut;
    private final Method before;
    private final Method after;
    private final Method afterException;
    private final int order;
    private final Map<Method, Boolean> pointcutResults = new ConcurrentHashMap<>();

    private AnnotatedAspectInterceptor(Object aspect, Method pointcut, Method before, Method after, Method afterException) {
        this.aspect = aspect;
        this.pointcut = pointcut;
        this.before = before;
        this.after = after;
        this.afterException = afterException;
        InterceptorOrder interceptorOrder = aspect.getClass().getAnnotation(InterceptorOrder.class);
        this.order = (interceptorOrder != null) ? interceptorOrder.value() : 0;
    }

    public static AnnotatedAspectInterceptor of(@NonNull Object aspect) {
        Class<?> clazz = aspect.getClass();
        if (!clazz.isAnnotationPresent(Aspect.class)) {
            throw new InvalidAspectException("Classe não anotada com @Aspect: " + clazz.getName(), clazz);
        }

        Method pointcut = null, before = null, after = null, afterException = null;
        for (Method method : clazz.getDeclaredMethods()) {
            if (method.isAnnotationPresent(Pointcut.class)) {
                pointcut = single(pointcut, method, Pointcut.class);
            } else if (method.isAnnotationPresent(BeforeExecution.class)) {
                before = single(before, method, BeforeExecution.class);
            } else if (method.isAnnotationPresent(AfterExecution.class)) {
                after = single(after, method, AfterExecution.class);
            } else if (method.isAnnotationPresent(AfterException.class)) {
                afterException = single(afterException, method, AfterException.class);
            }
        }

        if (pointcut != null) validatePointcut(pointcut);
        validateAdvice(before);
        validateAdvice(after);
        validateAdvice(afterException);

        return new AnnotatedAspectInterceptor(aspect, pointcut, before, after, afterException);
    }

    /**
     * Registro com o Pointcut já aplicado como filtro, o que evita criar contexto para métodos
     * que o aspecto não atende.
     */
    public InterceptorRegistration toRegistration() {
        return InterceptorRegistration.of(this).withMethodFilter(asMethodFilter());
    }

    public MethodFilter asMethodFilter() {
        return this::supports;
    }

    public boolean supports(@NonNull Method method) {
        if (pointcut == null) return true;
        return pointcutResults.computeIfAbsent(method, this::evaluatePointcut);
    }

    @Override
    public int getOrder() {
        return order;
    }

    @Override
    public void beforeInvoke(MethodCallContext context) throws Exception {
        if (before == null || !supports(context.getMethod())) return;
        executeAdvice(before, context, null);
    }

    @Override
    public Object transformResult(MethodCallContext context, Object previousOutput) throws Exception {
        if (!isTransformer() || !supports(context.getMethod())) return previousOutput;

        Object newResult = executeAdvice(after, context, previousOutput);
        if (newResult != null && isCompatible(context.getMethod(), newResult)) {
            return newResult;
        }
        log.debug("Resultado de @AfterExecution ignorado em {}: tipo incompatível ou null", context.getMethodName());
        return previousOutput;
    }

    @Override
    public void afterInvoke(MethodCallContext context) throws Exception {
        if (after == null || isTransformer() || !supports(context.getMethod())) return;
        executeAdvice(after, context, context.getResult());
    }

    @Override
    public void onException(MethodCallContext context) throws Exception {
        if (afterException == null || !supports(context.getMethod())) return;
        executeAdvice(afterException, context, null);
    }

    @Override
    public String toString() {
        return "AnnotatedAspectInterceptor{" + aspect.getClass().getName() + ", order=" + order + '}';
    }

    private boolean isTransformer() {
        return after != null && after.getReturnType() != void.class;
    }

    private boolean evaluatePointcut(Method method) {
        try {
            Object[] args = (pointcut.getParameterCount() == 1) ? new Object[]{method} : new Object[0];
            Object result = ReflectionUtils.invokeUnwrapped(pointcut, aspect, args);
            return result instanceof Boolean b && b;
        } catch (Throwable e) {
            log.warn("Pointcut {} falhou para {}. Aspecto não aplicado.", pointcut.getName(), method.getName(), e);
            return false;
        }
    }

    private Object executeAdvice(Method advice, MethodCallContext context, Object currentResult) throws Exception {
        Parameter[] parameters = advice.getParameters();
        Object[] invokeArgs = new Object[parameters.length];

        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            Class<?> paramType = parameter.getType();

            if (parameter.isAnnotationPresent(ProxyInstance.class)) {
                invokeArgs[i] = context.getProxy();
            } else if (parameter.isAnnotationPresent(ResultProxy.class)) {
                invokeArgs[i] = currentResult;
            } else if (Method.class.isAssignableFrom(paramType)) {
                invokeArgs[i] = context.getMethod();
            } else if (MethodCallContext.class.isAssignableFrom(paramType)) {
                invokeArgs[i] = context;
            } else if (Throwable.class.isAssignableFrom(paramType)) {
                Throwable exception = context.getException();
                invokeArgs[i] = paramType.isInstance(exception) ? exception : null;
            } else if (paramType.isArray() && paramType.getComponentType().equals(Object.class)) {
                invokeArgs[i] = context.getArgumentArray();
            }
        }

        try {
            return ReflectionUtils.invokeUnwrapped(advice, aspect, invokeArgs);
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new InterceptionException("Erro no advice " + advice.getName() + " de " + aspect.getClass().getName(), e);
        }
    }

    private static boolean isCompatible(Method method, Object value) {
        Class<?> returnType = method.getReturnType();
        if (returnType == void.class) return false;
        if (CompletionStage.class.isAssignableFrom(returnType)) return true;
        return wrap(returnType).isInstance(value);
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == boolean.class) return Boolean.class;
        if (type == byte.class) return Byte.class;
        if (type == short.class) return Short.class;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == float.class) return Float.class;
        if (type == double.class) return Double.class;
        return Character.class;
    }

    private static Method single(Method current, Method candidate, Class<? extends Annotation> annotation) {
        if (current != null) {
            throw new InvalidAspectException(
                    "Mais de um método @" + annotation.getSimpleName() + " em " + candidate.getDeclaringClass().getName(),
                    candidate.getDeclaringClass()
            );
        }
        candidate.setAccessible(true);
        return candidate;
    }

    private static void validatePointcut(Method pointcut) {
        Class<?> clazz = pointcut.getDeclaringClass();
        if (pointcut.getReturnType() != boolean.class && pointcut.getReturnType() != Boolean.class) {
            throw new InvalidAspectException("@Pointcut deve retornar boolean: " + clazz.getName() + "." + pointcut.getName(), clazz);
        }
        Class<?>[] types = pointcut.getParameterTypes();
        if (types.length > 1 || (types.length == 1 && types[0] != Method.class)) {
            throw new InvalidAspectException("@Pointcut aceita apenas um parâmetro Method: " + clazz.getName() + "." + pointcut.getName(), clazz);
        }
    }

    private static void validateAdvice(Method advice) {
        if (advice == null) return;
        for (Parameter parameter : advice.getParameters()) {
            Class<?> paramType = parameter.getType();
            boolean supported = parameter.isAnnotationPresent(ProxyInstance.class)
                    || parameter.isAnnotationPresent(ResultProxy.class)
                    || Method.class.isAssignableFrom(paramType)
                    || MethodCallContext.class.isAssignableFrom(paramType)
                    || Throwable.class.isAssignableFrom(paramType)
                    || (paramType.isArray() && paramType.getComponentType().equals(Object.class));
            if (!supported || paramType.isPrimitive()) {
                Class<?> clazz = advice.getDeclaringClass();
                throw new InvalidAspectException(
                        "Parâmetro não suportado '" + parameter.getName() + "' em " + clazz.getName() + "." + advice.getName(),
                        clazz
                );
            }
        }
    }

}
