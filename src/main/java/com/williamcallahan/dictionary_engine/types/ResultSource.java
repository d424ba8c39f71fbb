/**
 * Where a lookup result came from
 *
 * @author William Callahan
 */

package com.williamcallahan.dictionary_engine.types;

public enum ResultSource {
    CACHE,
    LOCAL_DATASET,
    REMOTE,
    STATIC_FALLBACK
}
