/**
 * Business-level not found: no source in the fallback chain produced a result
 *
 * @author William Callahan
 *
 * Features:
 * - User-facing message suitable for display as-is
 * - Records the fallback states visited before giving up
 */

package com.williamcallahan.dictionary_engine.exception;

import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.FallbackState;

import java.util.List;

public class LookupNotFoundException extends GenerationException {

    private final String query;
    private final List<FallbackState> trail;

    public LookupNotFoundException(String query, List<FallbackState> trail) {
        super(ErrorClassification.NOT_FOUND, userMessage(query));
        this.query = query;
        this.trail = List.copyOf(trail);
    }

    public static String userMessage(String query) {
        return "「" + query + "」が見つかりませんでした";
    }

    public String getQuery() {
        return query;
    }

    public List<FallbackState> getTrail() {
        return trail;
    }
}
