package uk.ac.ntu.loopserve.server.data;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.UnaryOperator;

@FunctionalInterface
public interface DataUpdate<T> {

    CompletionStage<T> apply(T current) throws Exception;

    static <T> DataUpdate<T> of(UnaryOperator<T> fn) {
        return current -> CompletableFuture.completedFuture(fn.apply(current));
    }
}
