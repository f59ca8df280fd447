package dtm.interception.support;

import dtm.interception.history.BaseEntityRepository;

public interface TodoRepository extends BaseEntityRepository<Todo> {
}
