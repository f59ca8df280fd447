package dtm.interception.exceptions;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Agrega as falhas lançadas pelos próprios hooks dos interceptadores durante uma única chamada.
 * <p>
 * Uma falha de hook nunca substitui o resultado (ou o erro) da operação real: ela é coletada aqui,
 * registrada em log e a notificação dos demais interceptadores continua normalmente.
 */
public class InterceptorHookException extends InterceptionException {

    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    public InterceptorHookException() {
        super("Falhas detectadas nos hooks dos interceptadores.");
    }

    public InterceptorHookException(String message) {
        super(message);
    }

    public void addError(Throwable error) {
        if (error != null) {
            this.errors.add(error);
        }
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Throwable getFirstError() {
        if (errors.isEmpty()) return null;
        return errors.get(0);
    }

    @Override
    public String getMessage() {
        if (errors.isEmpty()) {
            return super.getMessage();
        }

        String detailedErrors = errors.stream()
                .map(e -> String.format("[%s]: %s", e.getClass().getSimpleName(), e.getMessage()))
                .collect(Collectors.joining("\n  -> "));

        return super.getMessage() + "\nErros acumulados:\n  -> " + detailedErrors;
    }

}
