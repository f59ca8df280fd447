package dtm.interception.history;

import java.time.Instant;
import java.util.UUID;

/**
 * Registro imutável de uma alteração de entidade.
 *
 * @param snapshot estado da entidade: o criado em {@link HistoryAction#CREATE}, o anterior à
 *                 alteração em {@link HistoryAction#UPDATE} e {@link HistoryAction#DELETE}
 */
public record HistoryRecord<T>(
        UUID id,
        UUID entityId,
        String entityType,
        HistoryAction action,
        Instant timestamp,
        T snapshot,
        String actor
) {
}
