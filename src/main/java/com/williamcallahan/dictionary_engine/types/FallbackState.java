/**
 * States visited by the fallback chain while resolving a lookup
 *
 * @author William Callahan
 */

package com.williamcallahan.dictionary_engine.types;

public enum FallbackState {
    CACHE_LOOKUP,
    LOCAL_DATASET,
    REMOTE_GENERATION,
    STATIC_FALLBACK,
    DONE,
    FAILED
}
