package dtm.interception.prototypes;

import lombok.NonNull;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Predicado sobre o descritor da operação, usado para restringir um registro de interceptadores
 * a um subconjunto de métodos. Deve ser puro: o resultado pode ser cacheado por método.
 */
@FunctionalInterface
public interface MethodFilter {

    boolean matches(Method method);

    default MethodFilter and(@NonNull MethodFilter other) {
        return method -> matches(method) && other.matches(method);
    }

    default MethodFilter or(@NonNull MethodFilter other) {
        return method -> matches(method) || other.matches(method);
    }

    default MethodFilter negate() {
        return method -> !matches(method);
    }

    static MethodFilter all() {
        return method -> true;
    }

    static MethodFilter named(@NonNull String... names) {
        Set<String> accepted = new HashSet<>(Arrays.asList(names));
        return method -> accepted.contains(method.getName());
    }

    static MethodFilter annotatedWith(@NonNull Class<? extends Annotation> annotation) {
        return method -> method.isAnnotationPresent(annotation);
    }

}
