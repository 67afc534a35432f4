package com.github.rudygunawan.gencache.memo;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the argument of a memoized call to the parameters its cache key is derived from.
 *
 * <p>The extractor sees the argument exactly as the caller passed it, so any defaults the caller
 * applies must already be reflected there. Two calls whose extracted parameters are equal share one
 * cache entry.
 *
 * @param <A> the argument type
 */
@FunctionalInterface
public interface KeyExtractor<A> {

    /**
     * Returns the key parameters for {@code argument}.
     *
     * @param argument the call argument
     * @return the parameters, never {@code null}
     */
    Map<String, ?> extract(A argument);

    /**
     * Returns an extractor that keeps only the named parameters of {@code extractor}. Names the
     * delegate does not produce are skipped.
     *
     * @param extractor the full extractor
     * @param names the parameter names that identify a call
     * @param <A> the argument type
     * @return the restricted extractor
     */
    static <A> KeyExtractor<A> only(KeyExtractor<A> extractor, String... names) {
        Objects.requireNonNull(extractor, "extractor cannot be null");
        Objects.requireNonNull(names, "names cannot be null");
        List<String> kept = Collections.unmodifiableList(Arrays.asList(names.clone()));
        return argument -> {
            Map<String, ?> all = extractor.extract(argument);
            Map<String, Object> subset = new LinkedHashMap<>();
            for (String name : kept) {
                if (all.containsKey(name)) {
                    subset.put(name, all.get(name));
                }
            }
            return subset;
        };
    }
}
