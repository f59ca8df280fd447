package dtm.interception.annotations.aop;

import java.lang.annotation.*;

/**
 * Define um método como o Pointcut de um {@link Aspect}.
 *
 * <p>O método anotado decide se o aspecto deve ser aplicado a um determinado método do serviço.
 * Ele deve obrigatoriamente retornar {@code boolean}:</p>
 * <ul>
 *   <li>{@code true} - o método alvo será interceptado.</li>
 *   <li>{@code false} - o método alvo segue sem este aspecto.</li>
 * </ul>
 *
 * <p>O Pointcut é avaliado na resolução da cadeia, antes de qualquer chamada, por isso só pode
 * declarar um parâmetro {@link java.lang.reflect.Method}.</p>
 *
 * <pre>{@code
 * @Aspect
 * public class RemoveAuditAspect {
 *
 *     @Pointcut
 *     public boolean onlyRemove(Method method) {
 *         return method.getName().equals("remove");
 *     }
 *
 *     @BeforeExecution
 *     public void audit(Method method, Object[] args) {
 *         log.info("Removendo {}", args[0]);
 *     }
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Pointcut {

}
