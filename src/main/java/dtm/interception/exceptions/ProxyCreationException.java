package dtm.interception.exceptions;

import lombok.Getter;

@Getter
public class ProxyCreationException extends InterceptionException{
    private final Class<?> referenceClass;

    public ProxyCreationException(String message, Class<?> referenceClass, Throwable th){
        super(message, th);
        this.referenceClass = referenceClass;
    }

    public ProxyCreationException(String message, Class<?> referenceClass){
        super(message);
        this.referenceClass = referenceClass;
    }

}
