package dtm.interception.interceptors;

import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.MethodInterceptor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

/**
 * Registra em log o início e o desfecho de cada chamada interceptada.
 * Sucessos usam o nível configurado; falhas e cancelamentos usam WARN.
 */
@Slf4j
public class LoggingInterceptor implements MethodInterceptor {

    private final Level level;

    public LoggingInterceptor() {
        this(Level.INFO);
    }

    public LoggingInterceptor(@NonNull Level level) {
        this.level = level;
    }

    @Override
    public void beforeInvoke(MethodCallContext context) {
        log.atLevel(level).log("Executando {}.{} com {} argumento(s)",
                context.getServiceType().getSimpleName(), context.getMethodName(), context.getArgumentCount());
    }

    @Override
    public void afterInvoke(MethodCallContext context) {
        log.atLevel(level).log("{}.{} concluído", context.getServiceType().getSimpleName(), context.getMethodName());
    }

    @Override
    public void onException(MethodCallContext context) {
        if (context.isCancelled()) {
            log.warn("{}.{} cancelado", context.getServiceType().getSimpleName(), context.getMethodName());
            return;
        }
        Throwable error = context.getException();
        log.warn("{}.{} falhou: [{}] {}",
                context.getServiceType().getSimpleName(),
                context.getMethodName(),
                (error != null) ? error.getClass().getSimpleName() : "?",
                (error != null) ? error.getMessage() : "");
    }

    public Level getLevel() {
        return level;
    }

}
