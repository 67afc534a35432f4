package com.github.rudygunawan.gencache.memo;

/**
 * A generating function that may fail with a checked exception.
 *
 * @param <A> the argument type
 * @param <T> the result type
 */
@FunctionalInterface
public interface GeneratorFunction<A, T> {

    T apply(A argument) throws Exception;
}
