package dtm.interception.core;

/**
 * Estado de uma chamada interceptada. Sai de {@link #PENDING} uma única vez.
 */
public enum CallState {
    PENDING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
