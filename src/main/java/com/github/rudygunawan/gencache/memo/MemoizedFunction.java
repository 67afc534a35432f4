package com.github.rudygunawan.gencache.memo;

/**
 * A function whose results are cached by a {@link MemoizingCache}.
 *
 * @param <A> the argument type
 * @param <T> the result type
 * @see MemoizingCache#memoize
 */
@FunctionalInterface
public interface MemoizedFunction<A, T> {

    /**
     * Returns the cached result for {@code argument}, calling the underlying function on a miss.
     *
     * @param argument the call argument
     * @return the result
     * @throws Exception whatever the underlying function throws; nothing is cached in that case
     */
    T apply(A argument) throws Exception;
}
