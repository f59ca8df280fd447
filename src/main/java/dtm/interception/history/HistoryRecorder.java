package dtm.interception.history;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Armazena e consulta o histórico de alterações das entidades.
 *
 * <p>Os registros são agrupados pelo tipo concreto da entidade ({@code entity.getClass()}).
 * Todas as listas são devolvidas do mais recente para o mais antigo; registros com o mesmo
 * instante seguem a ordem inversa de inserção.</p>
 */
public interface HistoryRecorder {

    <T extends BaseEntity> HistoryRecord<T> add(T entity, HistoryAction action, String actor);

    <T extends BaseEntity> List<HistoryRecord<T>> getAll(Class<T> type, UUID entityId);

    /**
     * Estado da entidade no instante informado: o snapshot do último registro com
     * {@code timestamp <= instant}.
     *
     * @return vazio se não houver registro até o instante ou se o último for {@link HistoryAction#DELETE}
     */
    <T extends BaseEntity> Optional<T> getAtPointInTime(Class<T> type, UUID entityId, Instant instant);

    /**
     * Registros de todas as entidades do tipo com {@code from <= timestamp <= to}.
     */
    <T extends BaseEntity> List<HistoryRecord<T>> getByDateRange(Class<T> type, Instant from, Instant to);

    <T extends BaseEntity> Optional<HistoryRecord<T>> getLatest(Class<T> type, UUID entityId);

}
