package dtm.interception.utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

public final class ReflectionUtils {

    private ReflectionUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Invoca o método e relança a exceção original do alvo, sem o {@link InvocationTargetException}.
     */
    public static Object invokeUnwrapped(Method method, Object instance, Object... args) throws Throwable {
        try {
            return method.invoke(instance, args);
        } catch (InvocationTargetException invocationTargetException) {
            Throwable cause = invocationTargetException.getTargetException();
            throw (cause != null) ? cause : invocationTargetException;
        }
    }

    /**
     * Procura o argumento de tipo da interface genérica {@code genericInterface} implementada,
     * direta ou indiretamente, por {@code type}.
     *
     * @return a classe do argumento de tipo, ou {@code null} se não for possível determiná-la
     */
    public static Class<?> resolveTypeArgument(Class<?> type, Class<?> genericInterface, int index) {
        Class<?> current = type;
        while (current != null && current != Object.class) {
            Class<?> resolved = resolveFromInterfaces(current.getGenericInterfaces(), genericInterface, index);
            if (resolved != null) return resolved;
            current = current.getSuperclass();
        }
        return null;
    }

    private static Class<?> resolveFromInterfaces(Type[] interfaces, Class<?> genericInterface, int index) {
        for (Type candidate : interfaces) {
            if (candidate instanceof ParameterizedType parameterized) {
                if (parameterized.getRawType() == genericInterface) {
                    Type argument = parameterized.getActualTypeArguments()[index];
                    if (argument instanceof Class<?> clazz) return clazz;
                    if (argument instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) return raw;
                    return null;
                }
                if (parameterized.getRawType() instanceof Class<?> raw) {
                    Class<?> resolved = resolveFromInterfaces(raw.getGenericInterfaces(), genericInterface, index);
                    if (resolved != null) return resolved;
                }
            } else if (candidate instanceof Class<?> raw) {
                Class<?> resolved = resolveFromInterfaces(raw.getGenericInterfaces(), genericInterface, index);
                if (resolved != null) return resolved;
            }
        }
        return null;
    }

}
