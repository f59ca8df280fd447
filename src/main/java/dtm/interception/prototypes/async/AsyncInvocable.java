package dtm.interception.prototypes.async;

import java.util.concurrent.CompletionStage;

/**
 * A chamada real de uma operação suspensa: devolve o estágio que será concluído depois.
 *
 * @param <T> tipo do valor produzido pelo estágio
 */
@FunctionalInterface
public interface AsyncInvocable<T> {
    CompletionStage<T> proceed() throws Throwable;
}
