package com.williamcallahan.dictionary_engine.service.generation;

import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import reactor.core.publisher.Flux;

/**
 * Slow half of a two-stage dictionary lookup.
 * Emits its own 0-100 progress; the last update has done set.
 */
public interface DetailedStage {

    Flux<GenerationUpdate> run(String word, String targetLanguage, String nativeLanguage);
}
