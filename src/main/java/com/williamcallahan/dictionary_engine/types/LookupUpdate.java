/**
 * Caller-facing step of a lookup resolved through the fallback chain
 *
 * @author William Callahan
 *
 * Features:
 * - Progressive value with the source that produced it
 * - Final update has done set and carries the states the chain visited
 */

package com.williamcallahan.dictionary_engine.types;

import java.util.List;

public record LookupUpdate<V>(int progress, V value, ResultSource source, boolean done, List<FallbackState> trail) {

    public LookupUpdate {
        trail = trail == null ? List.of() : List.copyOf(trail);
    }

    public static <V> LookupUpdate<V> partial(int progress, V value, ResultSource source) {
        return new LookupUpdate<>(progress, value, source, false, List.of());
    }

    public static <V> LookupUpdate<V> done(V value, ResultSource source, List<FallbackState> trail) {
        return new LookupUpdate<>(100, value, source, true, trail);
    }
}
