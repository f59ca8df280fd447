package dtm.interception.annotations.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Desabilita a interceptação para o método ou interface de serviço anotado.
 *
 * <p>Em um método da interface, o proxy encaminha a chamada diretamente ao alvo, sem contexto e
 * sem interceptadores.</p>
 *
 * <p>Na própria interface de serviço, todos os métodos seguem direto para o alvo.</p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface DisableInterception {
}
