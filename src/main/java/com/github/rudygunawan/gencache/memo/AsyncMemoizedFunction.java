package com.github.rudygunawan.gencache.memo;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link MemoizedFunction}.
 *
 * @param <A> the argument type
 * @param <T> the result type
 * @see MemoizingCache#memoizeAsync
 */
@FunctionalInterface
public interface AsyncMemoizedFunction<A, T> {

    CompletableFuture<T> apply(A argument);
}
