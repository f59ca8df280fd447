package dtm.interception.prototypes;

/**
 * A chamada real, não interceptada, de uma operação imediata.
 */
@FunctionalInterface
public interface Invocable {
    Object proceed() throws Throwable;
}
