package dtm.interception.history;

import java.util.UUID;

/**
 * Entidade identificada por um {@link UUID}, única dentro do seu tipo.
 */
public interface BaseEntity {

    UUID getId();

}
