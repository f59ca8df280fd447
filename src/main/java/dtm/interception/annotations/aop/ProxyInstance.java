package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indica que o parâmetro anotado deve receber a instância do proxy que está executando o
 * método interceptado.
 *
 * <h3> Observações:</h3>
 * <ul>
 *     <li>Se a cadeia for executada fora de um proxy, o valor injetado será {@code null}.</li>
 *     <li>Chamar métodos do proxy de dentro de um advice passa novamente pela cadeia.</li>
 * </ul>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface ProxyInstance {
}
