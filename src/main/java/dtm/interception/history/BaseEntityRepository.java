package dtm.interception.history;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repositório consumido pelo {@link EntityHistoryInterceptor}. A implementação é externa a esta
 * biblioteca; os nomes {@code add}, {@code update} e {@code remove} identificam as operações auditadas.
 *
 * @param <T> tipo da entidade
 */
public interface BaseEntityRepository<T extends BaseEntity> {

    Optional<T> getById(UUID id);

    List<T> getAll();

    T add(T entity);

    T update(T entity);

    void remove(UUID id);

}
