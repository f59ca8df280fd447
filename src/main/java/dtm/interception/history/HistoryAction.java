package dtm.interception.history;

public enum HistoryAction {
    CREATE,
    UPDATE,
    DELETE
}
