package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Define a prioridade de um interceptador (ou de um {@link Aspect}) na cadeia.
 *
 * <p>Valores menores executam antes na fase Before e depois na fase After.
 * Na ausência da anotação a prioridade é {@code 0}.</p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface InterceptorOrder {
    int value();
}
