package dtm.interception.history;

import dtm.interception.annotations.aop.InterceptorOrder;
import dtm.interception.core.MethodCallContext;
import dtm.interception.prototypes.MethodInterceptor;
import dtm.interception.utils.ReflectionUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.UUID;

/**
 * Registra no {@link HistoryRecorder} as alterações feitas através de um {@link BaseEntityRepository}.
 *
 * <ul>
 *     <li>{@code add}: registra {@link HistoryAction#CREATE} com a entidade devolvida.</li>
 *     <li>{@code update}: registra {@link HistoryAction#UPDATE} com o estado anterior à alteração.</li>
 *     <li>{@code remove}: registra {@link HistoryAction#DELETE} com o estado anterior à remoção.</li>
 * </ul>
 *
 * <p>O estado anterior é lido com {@code getById} diretamente na instância real, antes da chamada.
 * Falhas do histórico nunca interrompem a operação do repositório.</p>
 */
@Slf4j
@InterceptorOrder(10)
public class EntityHistoryInterceptor implements MethodInterceptor {

    public static final String SNAPSHOT_KEY = "EntityHistoryInterceptor_Entity";
    public static final String ACTION_KEY = "EntityHistoryInterceptor_Action";

    private static final String ADD = "add";
    private static final String UPDATE = "update";
    private static final String REMOVE = "remove";

    private final HistoryRecorder historyRecorder;
    private final UserContextAccessor userContextAccessor;

    public EntityHistoryInterceptor(@NonNull HistoryRecorder historyRecorder) {
        this(historyRecorder, new DefaultUserContextAccessor());
    }

    public EntityHistoryInterceptor(@NonNull HistoryRecorder historyRecorder, @NonNull UserContextAccessor userContextAccessor) {
        this.historyRecorder = historyRecorder;
        this.userContextAccessor = userContextAccessor;
    }

    @Override
    public void beforeInvoke(MethodCallContext context) {
        if (!isRepositoryCall(context)) return;

        String methodName = context.getMethodName();
        if (!UPDATE.equals(methodName) && !REMOVE.equals(methodName)) return;

        UUID entityId = resolveEntityId(context);
        if (entityId == null) return;

        findCurrentState(context, entityId).ifPresent(current -> {
            context.putItem(SNAPSHOT_KEY, current);
            context.putItem(ACTION_KEY, UPDATE.equals(methodName) ? HistoryAction.UPDATE : HistoryAction.DELETE);
        });
    }

    @Override
    public void afterInvoke(MethodCallContext context) {
        if (!isRepositoryCall(context)) return;

        try {
            if (ADD.equals(context.getMethodName())) {
                Object result = context.getResult();
                if (result instanceof BaseEntity entity && isEntityOfRepository(context, entity)) {
                    historyRecorder.add(entity, HistoryAction.CREATE, userContextAccessor.getCurrentUsername());
                }
                return;
            }

            Optional<BaseEntity> snapshot = context.getItem(SNAPSHOT_KEY, BaseEntity.class);
            Optional<HistoryAction> action = context.getItem(ACTION_KEY, HistoryAction.class);
            if (snapshot.isPresent() && action.isPresent()) {
                historyRecorder.add(snapshot.get(), action.get(), userContextAccessor.getCurrentUsername());
            }
        } catch (Exception e) {
            log.warn("Falha ao registrar histórico de {}.{}", context.getTargetType().getSimpleName(), context.getMethodName(), e);
        }
    }

    @Override
    public void onException(MethodCallContext context) {
        if (!isRepositoryCall(context)) return;
        log.debug("Operação {} falhou, nenhum histórico registrado", context.getMethodName());
    }

    private boolean isRepositoryCall(MethodCallContext context) {
        return context.getTargetInstance() instanceof BaseEntityRepository<?>;
    }

    private UUID resolveEntityId(MethodCallContext context) {
        if (context.getArgumentCount() == 0) return null;

        Object argument = context.getArgument(0);
        if (UPDATE.equals(context.getMethodName()) && argument instanceof BaseEntity entity) {
            return entity.getId();
        }
        if (REMOVE.equals(context.getMethodName()) && argument instanceof UUID id) {
            return id;
        }
        return null;
    }

    private Optional<? extends BaseEntity> findCurrentState(MethodCallContext context, UUID entityId) {
        BaseEntityRepository<?> repository = (BaseEntityRepository<?>) context.getTargetInstance();
        try {
            Optional<? extends BaseEntity> current = repository.getById(entityId);
            return (current != null) ? current : Optional.empty();
        } catch (Exception e) {
            log.warn("Não foi possível ler o estado atual de {} antes de {}", entityId, context.getMethodName(), e);
            return Optional.empty();
        }
    }

    /**
     * Confere a entidade com o argumento de tipo do repositório, quando ele pode ser determinado.
     */
    private boolean isEntityOfRepository(MethodCallContext context, BaseEntity entity) {
        Class<?> entityType = ReflectionUtils.resolveTypeArgument(context.getTargetType(), BaseEntityRepository.class, 0);
        return entityType == null || entityType.isInstance(entity);
    }

}
