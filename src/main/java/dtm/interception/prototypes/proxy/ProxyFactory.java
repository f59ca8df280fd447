package dtm.interception.prototypes.proxy;

import dtm.interception.annotations.aop.InterceptionProxy;
import dtm.interception.core.DefaultInterceptorChain;
import dtm.interception.core.InterceptorRegistration;
import dtm.interception.exceptions.ProxyCreationException;
import dtm.interception.prototypes.InterceptorChain;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.NamingStrategy;
import net.bytebuddy.description.annotation.AnnotationDescription;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.dynamic.loading.MultipleParentClassLoader;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.matcher.ElementMatchers;

import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gera, em tempo de execução, proxies que implementam uma interface de serviço e encaminham cada
 * chamada ao {@link InterceptorChain} através de um {@link ObjectInterceptor}.
 *
 * <pre>{@code
 * TodoRepository proxy = ProxyFactory.newProxyObject(
 *         TodoRepository.class,
 *         repository,
 *         InterceptorRegistration.of(new LoggingInterceptor())
 * );
 * }</pre>
 *
 * <p>A classe gerada é cacheada por interface; cada proxy tem o seu próprio {@link ObjectInterceptor}.</p>
 */
@Slf4j
public class ProxyFactory {

    private static final String INTERCEPTOR_FIELD_NAME = "___interceptor";
    private static final Map<Class<?>, Class<?>> proxyCache = new ConcurrentHashMap<>();

    private final Class<?> serviceType;
    private final Object instance;
    private final InterceptorChain interceptorChain;

    public ProxyFactory(@NonNull Class<?> serviceType, @NonNull Object instance, @NonNull InterceptorChain interceptorChain){
        if (!serviceType.isInterface()) {
            throw new IllegalArgumentException("O tipo de serviço deve ser uma interface: " + serviceType.getName());
        }
        if (!serviceType.isInstance(instance)) {
            throw new IllegalArgumentException(
                    "A instância " + instance.getClass().getName() + " não implementa " + serviceType.getName()
            );
        }
        this.serviceType = serviceType;
        this.instance = instance;
        this.interceptorChain = interceptorChain;
    }

    public Object proxyObject() {
        Class<?> proxyClass = proxyCache.computeIfAbsent(serviceType, ProxyFactory::createProxyClass);

        try {
            Object proxyInstance = proxyClass.getDeclaredConstructor().newInstance();
            Field interceptorField = proxyClass.getDeclaredField(INTERCEPTOR_FIELD_NAME);
            interceptorField.setAccessible(true);
            interceptorField.set(proxyInstance, new ObjectInterceptor(instance, serviceType, interceptorChain));
            return proxyInstance;
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ProxyCreationException("Erro ao instanciar proxy para " + serviceType.getName(), serviceType, e);
        }
    }

    public static <T> T newProxyObject(
            @NonNull Class<T> serviceType,
            @NonNull T instance,
            @NonNull InterceptorRegistration... registrations
    ) {
        return newProxyObject(serviceType, instance, new DefaultInterceptorChain(List.of(registrations)));
    }

    public static <T> T newProxyObject(
            @NonNull Class<T> serviceType,
            @NonNull T instance,
            @NonNull InterceptorChain interceptorChain
    ) {
        ProxyFactory proxyFactory = new ProxyFactory(serviceType, instance, interceptorChain);
        return serviceType.cast(proxyFactory.proxyObject());
    }

    public static boolean isProxy(Object object) {
        return object != null && object.getClass().isAnnotationPresent(InterceptionProxy.class);
    }

    /**
     * Devolve a instância real por trás do proxy, ou o próprio objeto se ele não for um proxy.
     */
    @SuppressWarnings("unchecked")
    public static <T> T getTargetInstance(T object) {
        if (!isProxy(object)) return object;
        ObjectInterceptor interceptor = readInterceptor(object);
        return (interceptor != null) ? (T) interceptor.getDelegate() : object;
    }

    private static ObjectInterceptor readInterceptor(Object proxy) {
        try {
            Field interceptorField = proxy.getClass().getDeclaredField(INTERCEPTOR_FIELD_NAME);
            interceptorField.setAccessible(true);
            return (ObjectInterceptor) interceptorField.get(proxy);
        } catch (ReflectiveOperationException e) {
            throw new ProxyCreationException("Proxy sem interceptador: " + proxy.getClass().getName(), proxy.getClass(), e);
        }
    }

    private static Class<?> createProxyClass(Class<?> serviceType) {
        AnnotationDescription proxyAnnotation = AnnotationDescription.Builder
                .ofType(InterceptionProxy.class)
                .build();

        try (DynamicType.Unloaded<?> unloaded = new ByteBuddy()
                .with(new NamingStrategy.SuffixingRandom("InterceptionProxy"))
                .subclass(serviceType)
                .defineField(INTERCEPTOR_FIELD_NAME, ObjectInterceptor.class)
                .method(ElementMatchers.not(ElementMatchers.isDeclaredBy(Object.class))
                        .or(ElementMatchers.isToString())
                        .or(ElementMatchers.isHashCode())
                        .or(ElementMatchers.isEquals()))
                .intercept(MethodDelegation.withDefaultConfiguration()
                        .filter(ElementMatchers.named("intercept"))
                        .toField(INTERCEPTOR_FIELD_NAME))
                .annotateType(proxyAnnotation)
                .make()) {

            Class<?> loaded = load(unloaded, serviceType);
            log.debug("Classe de proxy {} gerada para {}", loaded.getName(), serviceType.getName());
            return loaded;
        } catch (Exception e) {
            throw new ProxyCreationException("Erro ao criar proxy para " + serviceType.getName(), serviceType, e);
        }
    }

    /**
     * Define a classe no pacote da interface através de um {@link MethodHandles.Lookup} privado,
     * o que permite interfaces não públicas. Sem acesso ao pacote (por exemplo, interfaces do JDK),
     * a classe vai para um class loader filho que enxerga a interface e o {@link ObjectInterceptor}.
     */
    private static Class<?> load(DynamicType.Unloaded<?> unloaded, Class<?> serviceType) {
        try {
            MethodHandles.Lookup privateLookup = MethodHandles.privateLookupIn(serviceType, MethodHandles.lookup());
            return unloaded
                    .load(serviceType.getClassLoader(), ClassLoadingStrategy.UsingLookup.of(privateLookup))
                    .getLoaded();
        } catch (IllegalAccessException | RuntimeException e) {
            log.debug("Lookup privado indisponível para {}, usando class loader dedicado", serviceType.getName());
            ClassLoader parent = new MultipleParentClassLoader.Builder()
                    .appendMostSpecific(serviceType, ObjectInterceptor.class)
                    .build();
            return unloaded
                    .load(parent, ClassLoadingStrategy.Default.WRAPPER)
                    .getLoaded();
        }
    }

}
