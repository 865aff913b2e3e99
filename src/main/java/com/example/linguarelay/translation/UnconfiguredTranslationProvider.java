package com.example.linguarelay.translation;

import com.example.linguarelay.model.LanguagePair;

/**
 * Stand-in used when no Gemini API key is configured: every call fails, so the gateway relays the
 * "translation unavailable" placeholder and the rest of the relay keeps working.
 */
public class UnconfiguredTranslationProvider implements TranslationProvider {

    @Override
    public String translate(String text, LanguagePair languages) {
        throw new IllegalStateException("No translation provider configured");
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
