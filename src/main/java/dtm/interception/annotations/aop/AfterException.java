package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indica que o método anotado deve ser executado <b>quando a chamada falhar ou for cancelada</b>.
 *
 * <p>O método apenas observa a falha: ele não consegue suprimi-la. Após a notificação de todos os
 * interceptadores, a exceção original é relançada ao chamador.</p>
 *
 * <h3>Parâmetros suportados:</h3>
 * <ul>
 *     <li>{@link java.lang.reflect.Method} → Método alvo que falhou.</li>
 *     <li>{@code Object[]} → Argumentos da chamada.</li>
 *     <li>{@code Throwable} → A exceção original.</li>
 *     <li>{@code MethodCallContext} → Contexto completo da chamada.</li>
 *     <li>{@code Object proxy} → Instância do proxy, se anotado com {@link ProxyInstance}.</li>
 * </ul>
 *
 * <pre>{@code
 * @Aspect
 * public class ErrorLoggerAspect {
 *
 *     @AfterException
 *     public void logError(Method method, Throwable error) {
 *         log.error("Erro no método {}: {}", method.getName(), error.getMessage());
 *     }
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AfterException {
}
