package com.example.linguarelay.translation;

import com.example.linguarelay.model.LanguagePair;

/**
 * Remote translation capability. Implementations make one attempt per call and throw on any failure;
 * retrying is the gateway's job.
 */
public interface TranslationProvider {

    /**
     * @param text      the utterance to translate
     * @param languages source and target language names
     * @return the translated text, never null
     * @throws Exception on transport errors or unusable responses
     */
    String translate(String text, LanguagePair languages) throws Exception;

    /** Whether this provider can actually reach a translation backend. */
    default boolean isConfigured() { return true; }
}
