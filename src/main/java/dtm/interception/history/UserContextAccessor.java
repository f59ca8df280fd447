package dtm.interception.history;

/**
 * Fornece o nome do usuário responsável pela operação em andamento.
 */
@FunctionalInterface
public interface UserContextAccessor {

    String getCurrentUsername();

}
