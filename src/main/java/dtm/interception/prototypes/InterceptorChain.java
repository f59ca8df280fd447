package dtm.interception.prototypes;

import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.async.AsyncInvocable;

import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executor da cadeia de interceptadores ao redor de uma chamada real.
 */
public interface InterceptorChain {

    /**
     * Resolve os interceptadores aplicáveis ao método, já ordenados por prioridade.
     *
     * @param method descritor da operação
     * @return lista imutável, vazia quando nenhum registro corresponde
     */
    List<MethodInterceptor> getInterceptors(Method method);

    /**
     * Executa uma operação imediata.
     *
     * @param context contexto da chamada
     * @param invocable a chamada real
     * @return o resultado final, após o pipeline de transformação
     * @throws Throwable a exceção original da chamada real (ou do hook Before que falhou)
     */
    Object execute(MethodCallContext context, Invocable invocable) throws Throwable;

    /**
     * Executa uma operação suspensa sem bloquear a thread chamadora.
     *
     * @param context contexto da chamada
     * @param invocable a chamada real, que devolve um {@link java.util.concurrent.CompletionStage}
     * @return future concluído exatamente uma vez com o resultado final, a falha original ou o cancelamento
     * @throws Throwable falhas ocorridas antes de existir um estágio (hook Before ou lançamento síncrono do alvo)
     */
    <T> CompletableFuture<T> executeAsync(MethodCallContext context, AsyncInvocable<T> invocable) throws Throwable;

}
