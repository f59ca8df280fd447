package dtm.interception.exceptions;

public class InvalidAspectException extends ProxyCreationException{

    public InvalidAspectException(String message, Class<?> referenceClass, Throwable th) {
        super(message, referenceClass, th);
    }

    public InvalidAspectException(String message, Class<?> referenceClass) {
        super(message, referenceClass);
    }

}
