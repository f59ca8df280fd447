package dtm.interception.configurations;

/**
 * Configurações do motor de interceptação. Todos os métodos possuem valor padrão, de modo que
 * {@code new InterceptionConfigurations() {}} já é uma configuração válida.
 */
public interface InterceptionConfigurations {

    /**
     * Se {@code true}, falhas de hooks {@code onException} são anexadas como suppressed na
     * exceção original antes de relançá-la. Padrão {@code false}: a exceção original chega
     * ao chamador sem nenhuma alteração.
     */
    default boolean isAttachHookErrorsAsSuppressed() {
        return false;
    }

    /**
     * Cacheia, por método, a lista resolvida de interceptadores aplicáveis.
     */
    default boolean isCacheResolvedInterceptors() {
        return true;
    }

    /**
     * Remove, por identidade, interceptadores repetidos quando mais de um registro corresponde.
     */
    default boolean isDeduplicateInterceptors() {
        return true;
    }

    /**
     * Registra em log (nível ERROR) as falhas agregadas dos hooks de cada chamada.
     */
    default boolean isLogHookErrors() {
        return true;
    }

}
