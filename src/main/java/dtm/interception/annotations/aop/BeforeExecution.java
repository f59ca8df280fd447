package dtm.interception.annotations.aop;

import java.lang.annotation.*;

/**
 * Indica que o método anotado deve ser executado <b>antes</b> da chamada real.
 *
 * <p>O retorno, se houver, é ignorado. O método pode alterar os argumentos
 * ({@code Object[] args}), que são os mesmos entregues ao alvo.</p>
 *
 * <h3>Parâmetros suportados:</h3>
 * <ul>
 *     <li>{@link java.lang.reflect.Method} → Método alvo que será executado.</li>
 *     <li>{@code Object[]} → Argumentos da chamada (mutáveis, tamanho fixo).</li>
 *     <li>{@code MethodCallContext} → Contexto completo da chamada.</li>
 *     <li>{@code Object proxy} → Instância proxy (se anotado com {@link ProxyInstance}).</li>
 * </ul>
 *
 * <p>Se o método lançar uma exceção, a chamada real não acontece e a falha segue o mesmo
 * caminho de uma falha do alvo.</p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface BeforeExecution {
}
