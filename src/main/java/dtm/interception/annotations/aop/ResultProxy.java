package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indica que o parâmetro anotado deve receber o resultado atual da chamada interceptada.
 *
 * <p>Em um {@link AfterExecution} que retorna valor, é a saída da etapa anterior do pipeline de
 * transformação. Em um {@link AfterExecution} {@code void}, é o resultado final.</p>
 *
 * <ul>
 *     <li>Se o método interceptado retornar {@code void}, o valor será {@code null}.</li>
 *     <li>Em operações assíncronas, é o valor já concluído, nunca o {@code CompletableFuture}.</li>
 * </ul>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface ResultProxy {
}
