package dtm.interception.annotations.aop;

import java.lang.annotation.*;

/**
 * Indica que o método anotado deve ser executado <b>após</b> a chamada real bem-sucedida.
 *
 * <h3> Comportamento:</h3>
 * <ul>
 *     <li>Se o método anotado retornar um valor (não {@code void}), ele atua como etapa de
 *     transformação: o valor retornado passa a ser o resultado entregue às próximas etapas e,
 *     ao final, ao chamador.</li>
 *     <li>Se o método anotado for {@code void}, ele apenas observa o contexto já transformado
 *     (hook {@code afterInvoke}).</li>
 *     <li>O resultado atual pode ser recebido em um parâmetro anotado com {@link ResultProxy}.</li>
 * </ul>
 *
 * <h3> Parâmetros suportados:</h3>
 * <ul>
 *     <li>{@link java.lang.reflect.Method} → Método alvo executado.</li>
 *     <li>{@code Object[]} → Argumentos da chamada.</li>
 *     <li>{@code MethodCallContext} → Contexto completo da chamada.</li>
 *     <li>{@code Object proxy} → Instância proxy, se anotado com {@link ProxyInstance}.</li>
 *     <li>{@code Object} → Resultado atual, se anotado com {@link ResultProxy}.</li>
 * </ul>
 *
 * <h3> Exemplo de uso:</h3>
 * <pre>{@code
 * @Aspect
 * public class UpperCaseAspect {
 *
 *     @AfterExecution
 *     public Object upper(@ResultProxy Object result) {
 *         return result instanceof String s ? s.toUpperCase() : result;
 *     }
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AfterExecution {
}
