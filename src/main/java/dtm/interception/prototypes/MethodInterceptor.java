package dtm.interception.prototypes;

import dtm.interception.annotations.aop.InterceptorOrder;
import dtm.interception.core.MethodCallContext;

/**
 * Contrato de um interceptador de métodos: quatro hooks executados ao redor da chamada real e
 * uma prioridade explícita.
 *
 * <h3>Ordem lógica dos hooks:</h3>
 * <ol>
 *     <li>{@link #beforeInvoke} - ordem crescente de {@link #getOrder()}.</li>
 *     <li>Chamada real.</li>
 *     <li>{@link #transformResult} - ordem crescente, cada etapa recebe a saída da anterior.</li>
 *     <li>{@link #afterInvoke} - ordem decrescente (desempilhamento).</li>
 * </ol>
 * <p>Em caso de falha ou cancelamento, {@link #onException} é chamado em ordem crescente em
 * todos os interceptadores aplicáveis e a exceção original é relançada. Um interceptador pode
 * reagir (log, compensação), mas nunca suprimir o erro.</p>
 *
 * <p>As implementações devem ser sem estado ou sincronizadas externamente: a mesma instância pode
 * ser chamada de várias threads ao mesmo tempo. Dados de uma única chamada devem ficar em
 * {@link MethodCallContext#getItems()}.</p>
 *
 * <p>Todos os hooks têm implementação vazia, basta sobrescrever os necessários.</p>
 */
public interface MethodInterceptor {

    /**
     * Executado antes da chamada real. Pode alterar os argumentos via
     * {@link MethodCallContext#setArgument(int, Object)}.
     *
     * @param context contexto da chamada
     * @throws Exception aborta a chamada real; a exceção segue o caminho de falha
     */
    default void beforeInvoke(MethodCallContext context) throws Exception {
    }

    /**
     * Executado após a chamada real bem-sucedida e após o pipeline de transformação.
     * {@link MethodCallContext#getResult()} já contém o valor final.
     *
     * @param context contexto da chamada
     * @throws Exception falhas são registradas e agregadas, nunca alteram o resultado
     */
    default void afterInvoke(MethodCallContext context) throws Exception {
    }

    /**
     * Executado quando a chamada real (ou um hook Before) falha ou é cancelada.
     *
     * @param context contexto da chamada, com {@link MethodCallContext#getException()} preenchido
     * @throws Exception falhas são registradas e agregadas, nunca mascaram o erro original
     */
    default void onException(MethodCallContext context) throws Exception {
    }

    /**
     * Etapa do pipeline de transformação do resultado.
     *
     * @param context        contexto da chamada
     * @param previousOutput saída da etapa anterior (ou o resultado real, na primeira etapa)
     * @return a nova saída
     * @throws Exception a etapa é ignorada e a saída anterior segue adiante
     */
    default Object transformResult(MethodCallContext context, Object previousOutput) throws Exception {
        return previousOutput;
    }

    /**
     * Prioridade do interceptador. Menor executa antes na fase Before.
     * Por padrão lê {@link InterceptorOrder} na classe, ou {@code 0}.
     */
    default int getOrder() {
        InterceptorOrder order = getClass().getAnnotation(InterceptorOrder.class);
        return order != null ? order.value() : 0;
    }

}
