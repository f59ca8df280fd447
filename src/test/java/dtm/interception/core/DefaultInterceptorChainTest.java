package dtm.interception.core;

import dtm.interception.prototypes.MethodFilter;
import dtm.interception.prototypes.MethodInterceptor;
import dtm.interception.storage.InterceptionConfigurationsStorage;
import dtm.interception.support.Greeter;
import dtm.interception.support.RecordingInterceptor;
import dtm.interception.support.SimpleGreeter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInterceptorChainTest {

    private List<String> journal;
    private SimpleGreeter target;
    private Method greet;
    private Method greetAsync;

    @BeforeEach
    void setup() throws Exception {
        journal = new CopyOnWriteArrayList<>();
        target = new SimpleGreeter(journal);
        greet = Greeter.class.getMethod("greet", String.class);
        greetAsync = Greeter.class.getMethod("greetAsync", String.class);
    }

    @Test
    void withoutInterceptorsCallsThroughUntouched() throws Throwable {
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of());
        MethodCallContext context = new MethodCallContext(target, greet, new Object[]{"Ana"});

        Object result = chain.execute(context, () -> target.greet("Ana"));

        assertEquals("Olá, Ana", result);
        assertEquals(List.of("real"), journal);
        assertEquals(CallState.PENDING, context.getState());
    }

    @Test
    void beforeRunsAscendingAndAfterDescending() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(
                new RecordingInterceptor("B", journal, 2),
                new RecordingInterceptor("A", journal, 1)
        );

        Object result = chain.execute(newContext("Ana"), () -> target.greet("Ana"));

        assertEquals("Olá, Ana", result);
        assertEquals(List.of("A.Before", "B.Before", "real", "B.After", "A.After"), journal);
    }

    @Test
    void equalOrderKeepsRegistrationOrder() throws Throwable {
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of(
                InterceptorRegistration.of(new RecordingInterceptor("first", journal)),
                InterceptorRegistration.of(new RecordingInterceptor("second", journal))
        ));

        chain.execute(newContext("Ana"), () -> target.greet("Ana"));

        assertEquals(List.of("first.Before", "second.Before", "real", "second.After", "first.After"), journal);
    }

    @Test
    void failureReachesEveryInterceptorAndRethrowsTheOriginal() {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(
                new RecordingInterceptor("A", journal, 1),
                new RecordingInterceptor("B", journal, 2)
        );
        IllegalStateException failure = new IllegalStateException("falhou");
        MethodCallContext context = newContext("Ana");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> chain.execute(context, () -> { throw failure; }));

        assertSame(failure, thrown);
        assertSame(failure, context.getException());
        assertEquals(CallState.FAILED, context.getState());
        assertEquals(List.of("A.Before", "B.Before", "A.Exception", "B.Exception"), journal);
    }

    @Test
    void beforeFailurePreventsTheRealCall() {
        IllegalArgumentException rejected = new IllegalArgumentException("negado");
        MethodInterceptor guard = new MethodInterceptor() {
            @Override
            public void beforeInvoke(MethodCallContext context) {
                throw rejected;
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(guard, new RecordingInterceptor("A", journal, 1));

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> chain.execute(newContext("Ana"), () -> target.greet("Ana")));

        assertSame(rejected, thrown);
        assertFalse(journal.contains("real"));
        assertEquals(List.of("A.Exception"), journal);
    }

    @Test
    void transformationsComposeInAscendingOrder() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(
                new RecordingInterceptor("B", journal, 2, "-B"),
                new RecordingInterceptor("A", journal, 1, "-A")
        );
        MethodCallContext context = newContext("Ana");

        Object result = chain.execute(context, () -> "x");

        assertEquals("x-A-B", result);
        assertEquals("x-A-B", context.getResult());
        assertTrue(context.isSucceeded());
    }

    @Test
    void afterHooksSeeTheTransformedResult() throws Throwable {
        List<Object> seen = new CopyOnWriteArrayList<>();
        MethodInterceptor observer = new MethodInterceptor() {
            @Override
            public void afterInvoke(MethodCallContext context) {
                seen.add(context.getResult());
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(observer, new RecordingInterceptor("A", journal, 5, "!"));

        chain.execute(newContext("Ana"), () -> "x");

        assertEquals(List.of("x!"), seen);
    }

    @Test
    void failingTransformStageIsSkipped() throws Throwable {
        MethodInterceptor broken = new MethodInterceptor() {
            @Override
            public Object transformResult(MethodCallContext context, Object previousOutput) {
                throw new IllegalStateException("transformação quebrada");
            }

            @Override
            public int getOrder() {
                return 1;
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(
                new RecordingInterceptor("A", journal, 0, "-A"),
                broken,
                new RecordingInterceptor("C", journal, 2, "-C")
        );
        MethodCallContext context = newContext("Ana");

        Object result = chain.execute(context, () -> "x");

        assertEquals("x-A-C", result);
        assertEquals(1, context.getHookErrors().size());
    }

    @Test
    void afterHookFailureIsCollectedAndRemainingHooksRun() throws Throwable {
        MethodInterceptor broken = new MethodInterceptor() {
            @Override
            public void afterInvoke(MethodCallContext context) throws Exception {
                throw new IOException("after quebrado");
            }

            @Override
            public int getOrder() {
                return 2;
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1), broken);
        MethodCallContext context = newContext("Ana");

        Object result = chain.execute(context, () -> target.greet("Ana"));

        assertEquals("Olá, Ana", result);
        assertEquals(List.of("A.Before", "real", "A.After"), journal);
        assertEquals(1, context.getHookErrors().size());
        assertInstanceOf(IOException.class, context.getHookErrors().get(0));
    }

    @Test
    void exceptionHookFailureNeverMasksTheOriginal() {
        RuntimeException hookFailure = new RuntimeException("hook quebrado");
        MethodInterceptor broken = new MethodInterceptor() {
            @Override
            public void onException(MethodCallContext context) {
                throw hookFailure;
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(broken, new RecordingInterceptor("A", journal, 1));
        IllegalStateException failure = new IllegalStateException("falhou");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> chain.execute(newContext("Ana"), () -> { throw failure; }));

        assertSame(failure, thrown);
        assertEquals(0, thrown.getSuppressed().length);
        assertTrue(journal.contains("A.Exception"));
    }

    @Test
    void exceptionHookFailuresCanBeAttachedAsSuppressed() {
        RuntimeException hookFailure = new RuntimeException("hook quebrado");
        MethodInterceptor broken = new MethodInterceptor() {
            @Override
            public void onException(MethodCallContext context) {
                throw hookFailure;
            }
        };
        DefaultInterceptorChain chain = new DefaultInterceptorChain(
                List.of(InterceptorRegistration.of(broken)),
                InterceptionConfigurationsStorage.builder().attachHookErrorsAsSuppressed(true).build()
        );
        IllegalStateException failure = new IllegalStateException("falhou");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> chain.execute(newContext("Ana"), () -> { throw failure; }));

        assertSame(failure, thrown);
        assertArrayEquals(new Throwable[]{hookFailure}, thrown.getSuppressed());
    }

    @Test
    void asyncSuccessRunsAfterHooksOnCompletion() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1, "-A"));
        CompletableFuture<String> pending = new CompletableFuture<>();
        MethodCallContext context = newAsyncContext("Ana");

        CompletableFuture<String> result = chain.executeAsync(context, () -> pending);

        assertFalse(result.isDone());
        assertEquals(List.of("A.Before"), journal);

        pending.complete("x");

        assertEquals("x-A", result.join());
        assertEquals(List.of("A.Before", "A.After"), journal);
        assertEquals("x-A", context.getResult());
    }

    @Test
    void asyncFailureCompletesWithTheOriginalCause() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));
        CompletableFuture<String> pending = new CompletableFuture<>();
        IllegalStateException failure = new IllegalStateException("falhou depois");
        MethodCallContext context = newAsyncContext("Ana");

        CompletableFuture<String> result = chain.executeAsync(context, () -> pending);
        pending.completeExceptionally(failure);

        CompletionException thrown = assertThrows(CompletionException.class, result::join);
        assertSame(failure, thrown.getCause());
        assertSame(failure, context.getException());
        assertEquals(List.of("A.Before", "A.Exception"), journal);
    }

    @Test
    void callerCancellationIsForwardedAndSkipsAfter() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));
        CompletableFuture<String> pending = new CompletableFuture<>();
        MethodCallContext context = newAsyncContext("Ana");

        CompletableFuture<String> result = chain.executeAsync(context, () -> pending);
        result.cancel(true);

        assertTrue(result.isCancelled());
        assertTrue(pending.isCancelled());
        assertTrue(context.isCancelled());
        assertInstanceOf(CancellationException.class, context.getException());
        assertEquals(List.of("A.Before", "A.Exception"), journal);
        assertThrows(CancellationException.class, result::join);
    }

    @Test
    void cancellationUnwindsEvenWhenTheStageRejectsCancel() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));
        CompletableFuture<String> backing = new CompletableFuture<>();
        MethodCallContext context = newAsyncContext("Ana");

        CompletableFuture<String> result = chain.executeAsync(context, backing::minimalCompletionStage);
        result.cancel(true);

        assertTrue(result.isCancelled());
        assertTrue(context.isCancelled());
        assertEquals(List.of("A.Before", "A.Exception"), journal);

        backing.complete("tarde demais");

        assertEquals(List.of("A.Before", "A.Exception"), journal);
    }

    @Test
    void cancelledStageSurfacesAsCancelledFuture() throws Throwable {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));
        CompletableFuture<String> pending = new CompletableFuture<>();
        MethodCallContext context = newAsyncContext("Ana");

        CompletableFuture<String> result = chain.executeAsync(context, () -> pending);
        pending.cancel(true);

        assertTrue(result.isCancelled());
        assertTrue(context.isCancelled());
        assertEquals(List.of("A.Before", "A.Exception"), journal);
    }

    @Test
    void asyncFailureBeforeTheStageIsThrownSynchronously() {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));
        IllegalStateException failure = new IllegalStateException("sem futuro");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> chain.executeAsync(newAsyncContext("Ana"), () -> { throw failure; }));

        assertSame(failure, thrown);
        assertEquals(List.of("A.Before", "A.Exception"), journal);
    }

    @Test
    void nullStageIsRejected() {
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(new RecordingInterceptor("A", journal, 1));

        assertThrows(NullPointerException.class, () -> chain.executeAsync(newAsyncContext("Ana"), () -> null));
        assertEquals(List.of("A.Before", "A.Exception"), journal);
    }

    @Test
    void methodFilterRestrictsTheRegistration() throws Exception {
        MethodInterceptor audit = new RecordingInterceptor("audit", journal);
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of(
                InterceptorRegistration.of(audit).withMethodFilter(MethodFilter.named("greetAsync"))
        ));

        assertTrue(chain.getInterceptors(greet).isEmpty());
        assertEquals(List.of(audit), chain.getInterceptors(greetAsync));
    }

    @Test
    void failingFilterSkipsTheRegistration() {
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of(
                InterceptorRegistration.of(new RecordingInterceptor("A", journal))
                        .withMethodFilter(method -> { throw new IllegalStateException("filtro quebrado"); }),
                InterceptorRegistration.of(new RecordingInterceptor("B", journal))
        ));

        assertEquals(1, chain.getInterceptors(greet).size());
    }

    @Test
    void sameInstanceRegisteredTwiceRunsOnce() throws Throwable {
        RecordingInterceptor shared = new RecordingInterceptor("A", journal);
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of(
                InterceptorRegistration.of(shared),
                InterceptorRegistration.of(shared)
        ));

        chain.execute(newContext("Ana"), () -> target.greet("Ana"));

        assertEquals(List.of("A.Before", "real", "A.After"), journal);
    }

    @Test
    void deduplicationCanBeDisabled() {
        RecordingInterceptor shared = new RecordingInterceptor("A", journal);
        DefaultInterceptorChain chain = new DefaultInterceptorChain(
                List.of(InterceptorRegistration.of(shared), InterceptorRegistration.of(shared)),
                InterceptionConfigurationsStorage.builder().deduplicateInterceptors(false).build()
        );

        assertEquals(2, chain.getInterceptors(greet).size());
    }

    @Test
    void registrationsAreCopiedOnConstruction() {
        InterceptorRegistration registration = InterceptorRegistration.of(new RecordingInterceptor("A", journal));
        DefaultInterceptorChain chain = new DefaultInterceptorChain(List.of(registration));

        registration.addInterceptor(new RecordingInterceptor("B", journal));

        assertEquals(1, chain.getInterceptors(greet).size());
    }

    @Test
    void interceptorsAreSharedAcrossCallsButItemsAreNot() throws Throwable {
        AtomicBoolean leaked = new AtomicBoolean(false);
        MethodInterceptor stateful = new MethodInterceptor() {
            @Override
            public void beforeInvoke(MethodCallContext context) {
                if (context.getItems().containsKey("seen")) leaked.set(true);
                context.putItem("seen", true);
            }
        };
        DefaultInterceptorChain chain = DefaultInterceptorChain.of(stateful);

        chain.execute(newContext("Ana"), () -> "a");
        chain.execute(newContext("Bia"), () -> "b");

        assertFalse(leaked.get());
    }

    private MethodCallContext newContext(String name) {
        return new MethodCallContext(target, greet, new Object[]{name});
    }

    private MethodCallContext newAsyncContext(String name) {
        return new MethodCallContext(target, greetAsync, new Object[]{name});
    }

}
