package dtm.interception.exceptions;

public class InterceptionException extends RuntimeException{

    public InterceptionException(String message){
        super(message);
    }

    public InterceptionException(Throwable cause) {
        super(cause);
    }

    public InterceptionException(String message, Throwable th){
        super(message, th);
    }

    public InterceptionException(String message, Throwable cause,
                        boolean enableSuppression,
                        boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

}
