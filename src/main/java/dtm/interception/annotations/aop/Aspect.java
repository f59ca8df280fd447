package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca uma classe como um Aspecto.
 *
 * Classes anotadas com @Aspect podem ser adaptadas para {@code MethodInterceptor} através de
 * {@code AnnotatedAspectInterceptor.of(instancia)}, que lê os métodos anotados com
 * {@link Pointcut}, {@link BeforeExecution}, {@link AfterExecution} e {@link AfterException}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE})
public @interface Aspect { }
