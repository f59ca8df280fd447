package dtm.interception.exceptions;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InterceptorHookExceptionTest {

    @Test
    void accumulatesErrorsInOrder() {
        InterceptorHookException aggregated = new InterceptorHookException("Falhas em greet");
        IOException first = new IOException("primeiro");
        IllegalStateException last = new IllegalStateException("último");

        aggregated.addError(first);
        aggregated.addError(null);
        aggregated.addError(last);

        assertTrue(aggregated.hasErrors());
        assertEquals(List.of(first, last), aggregated.getErrors());
        assertSame(first, aggregated.getFirstError());
        assertTrue(aggregated.getMessage().contains("[IOException]: primeiro"));
        assertTrue(aggregated.getMessage().contains("[IllegalStateException]: último"));
    }

    @Test
    void emptyAggregateKeepsItsMessage() {
        InterceptorHookException aggregated = new InterceptorHookException();

        assertFalse(aggregated.hasErrors());
        assertNull(aggregated.getFirstError());
        assertEquals("Falhas detectadas nos hooks dos interceptadores.", aggregated.getMessage());
    }

}
