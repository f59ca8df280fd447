package dtm.interception.support;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public interface Greeter {

    String greet(String name);

    CompletableFuture<String> greetAsync(String name);

    CompletionStage<Integer> countAsync();

    void failChecked() throws IOException;

    int length(String value);

}
